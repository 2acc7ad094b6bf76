package org.nowstart.pitwall.data.type;

public enum RuleCategory {
    WEATHER("Weather"),
    STRATEGY("Strategy"),
    STINT("Stint"),
    HISTORICAL("Historical");

    private final String label;

    RuleCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

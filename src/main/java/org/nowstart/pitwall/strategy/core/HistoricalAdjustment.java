package org.nowstart.pitwall.strategy.core;

import java.util.List;

public record HistoricalAdjustment(
        double adjustmentS,
        List<String> notes,
        boolean capped
) {

    public static final HistoricalAdjustment NONE = new HistoricalAdjustment(0.0, List.of(), false);

    public HistoricalAdjustment {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}

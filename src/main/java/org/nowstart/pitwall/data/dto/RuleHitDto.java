package org.nowstart.pitwall.data.dto;

public record RuleHitDto(
        String category,
        String ruleName,
        String observedValue,
        String impact
) {
}

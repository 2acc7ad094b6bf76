package org.nowstart.pitwall.strategy.core;

import org.nowstart.pitwall.data.type.RuleCategory;

/**
 * One literal fact taken from a simulation result. Renderers may rephrase it but must not
 * derive anything beyond what the strings state.
 *
 * @param category      grouping used by renderers
 * @param ruleName      stable rule label
 * @param observedValue pre-formatted observed value
 * @param impact        pre-formatted consequence
 */
public record RuleHit(
        RuleCategory category,
        String ruleName,
        String observedValue,
        String impact
) {

    public RuleHit {
        if (category == null) {
            throw new IllegalArgumentException("rule category is required");
        }
        if (ruleName == null || ruleName.isBlank()) {
            throw new IllegalArgumentException("rule name is required");
        }
        observedValue = observedValue == null ? "" : observedValue;
        impact = impact == null ? "" : impact;
    }
}

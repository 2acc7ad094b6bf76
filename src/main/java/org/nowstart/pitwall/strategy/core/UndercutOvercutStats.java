package org.nowstart.pitwall.strategy.core;

public record UndercutOvercutStats(
        int undercutAttempts,
        double undercutSuccessRate,
        int overcutAttempts,
        double overcutSuccessRate,
        double typicalUndercutGainS
) {
}

package org.nowstart.pitwall.strategy.core;

public record StopCountDistribution(
        double oneStopPct,
        double twoStopPct,
        double threePlusPct,
        int n
) {
}

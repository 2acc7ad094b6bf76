package org.nowstart.pitwall.strategy.core;

public record RankedStrategy(
        int position,
        Strategy strategy,
        double effectiveScoreS,
        double gapToBestS
) {
}

package org.nowstart.pitwall.strategy.core;

import java.util.List;

public record HistoricalProfile(
        String circuitKey,
        FirstStopLapStats firstStopLap,
        StopCountDistribution stopCountDistribution,
        List<StrategySequence> commonSequences,
        UndercutOvercutStats undercutOvercut
) {

    public HistoricalProfile {
        commonSequences = commonSequences == null ? List.of() : List.copyOf(commonSequences);
    }
}

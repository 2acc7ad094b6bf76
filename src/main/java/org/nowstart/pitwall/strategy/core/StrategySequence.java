package org.nowstart.pitwall.strategy.core;

import java.util.List;
import org.nowstart.pitwall.data.exception.InvalidRaceConfigException;

public record StrategySequence(
        int stops,
        List<String> sequence,
        double frequencyPct,
        int n
) {

    public StrategySequence {
        if (sequence == null) {
            sequence = List.of();
        } else {
            for (String code : sequence) {
                if (code == null || code.isBlank()) {
                    throw new InvalidRaceConfigException("historical sequence codes must not be blank, got " + sequence);
                }
            }
            sequence = List.copyOf(sequence);
        }
    }
}

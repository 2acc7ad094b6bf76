package org.nowstart.pitwall.strategy.core;

import java.util.List;

public record RankedResult(
        List<RankedStrategy> ranking,
        String recommended,
        double deltaS,
        List<String> guardNotes
) {

    public RankedResult {
        ranking = ranking == null ? List.of() : List.copyOf(ranking);
        guardNotes = guardNotes == null ? List.of() : List.copyOf(guardNotes);
    }

    public List<Strategy> strategies() {
        return ranking.stream().map(RankedStrategy::strategy).toList();
    }

    public RankedStrategy positionOf(Strategy strategy) {
        return ranking.stream()
                .filter(ranked -> ranked.strategy().name().equals(strategy.name()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("strategy not ranked: " + strategy.name()));
    }
}

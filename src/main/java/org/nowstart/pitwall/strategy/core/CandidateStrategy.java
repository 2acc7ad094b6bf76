package org.nowstart.pitwall.strategy.core;

import java.util.List;

public record CandidateStrategy(
        String name,
        List<StintPlan> stints,
        String weatherNote
) {

    public CandidateStrategy {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("candidate name is required");
        }
        if (stints == null || stints.isEmpty()) {
            throw new IllegalArgumentException("candidate requires at least one stint");
        }
        stints = List.copyOf(stints);
        weatherNote = weatherNote == null ? "" : weatherNote;
    }

    public int stops() {
        return stints.size() - 1;
    }

    public int totalLaps() {
        return stints.stream().mapToInt(StintPlan::laps).sum();
    }

    public List<String> compounds() {
        return stints.stream().map(StintPlan::compound).toList();
    }

    /**
     * Candidates sharing a shape key differ only in their stint boundaries.
     */
    public String shapeKey() {
        return String.join(">", compounds());
    }
}

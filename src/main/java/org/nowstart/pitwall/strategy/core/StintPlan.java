package org.nowstart.pitwall.strategy.core;

public record StintPlan(
        String compound,
        int laps,
        int minLaps,
        int maxLaps
) {

    public StintPlan {
        if (compound == null || compound.isBlank()) {
            throw new IllegalArgumentException("stint compound is required");
        }
        if (minLaps < 1 || minLaps > maxLaps) {
            throw new IllegalArgumentException("stint envelope must satisfy 1 <= minLaps <= maxLaps");
        }
        if (laps < minLaps || laps > maxLaps) {
            throw new IllegalArgumentException("stint seed " + laps + " outside [" + minLaps + ", " + maxLaps + "]");
        }
    }

    public boolean admits(int stintLaps) {
        return stintLaps >= minLaps && stintLaps <= maxLaps;
    }
}

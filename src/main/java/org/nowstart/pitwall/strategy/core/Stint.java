package org.nowstart.pitwall.strategy.core;

import java.util.List;

public record Stint(
        int stintNumber,
        String compound,
        int startLap,
        int endLap,
        int laps,
        double stintTimeS,
        double avgLapTimeS,
        double finalLapTimeS,
        int cliffLaps,
        boolean wetTyre,
        List<Double> lapTimesS
) {

    public Stint {
        if (laps != endLap - startLap + 1) {
            throw new IllegalArgumentException("stint laps must match its lap range");
        }
        lapTimesS = lapTimesS == null ? List.of() : List.copyOf(lapTimesS);
    }
}

package org.nowstart.pitwall.strategy.core;

public record RaceConditions(
        RaceConfig race,
        WeatherState weather,
        Integer crossoverLap
) {

    public int lapsPastCrossover(int raceLap) {
        return crossoverLap == null ? 0 : Math.max(0, raceLap - crossoverLap);
    }
}

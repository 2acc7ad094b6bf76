package org.nowstart.pitwall.strategy.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.nowstart.pitwall.data.exception.InvalidRaceConfigException;

public record SimulationInput(
        RaceConfig race,
        WeatherState weather,
        Map<String, CompoundParams> compounds,
        HistoricalProfile historicalProfile,
        Map<String, String> compoundRoles
) {

    public SimulationInput {
        if (race == null) {
            throw new InvalidRaceConfigException("race config is required");
        }
        if (weather == null) {
            throw new InvalidRaceConfigException("weather state is required");
        }
        compounds = compounds == null ? Map.of() : unmodifiableCopy(compounds);
        compoundRoles = compoundRoles == null ? Map.of() : unmodifiableCopy(compoundRoles);
    }

    public static SimulationInput of(RaceConfig race, WeatherState weather, Map<String, CompoundParams> compounds) {
        return new SimulationInput(race, weather, compounds, null, null);
    }

    private static <V> Map<String, V> unmodifiableCopy(Map<String, V> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

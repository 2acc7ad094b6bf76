package org.nowstart.pitwall.strategy.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SimulationResult(
        RaceConfig race,
        WeatherState weather,
        Integer crossoverLap,
        RankedResult ranked,
        Map<String, List<RuleHit>> ruleHits,
        List<String> advisories,
        String model
) {

    public SimulationResult {
        ruleHits = ruleHits == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(ruleHits));
        advisories = advisories == null ? List.of() : List.copyOf(advisories);
    }
}

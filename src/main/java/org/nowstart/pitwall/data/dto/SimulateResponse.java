package org.nowstart.pitwall.data.dto;

import java.util.List;
import java.util.Map;
import org.nowstart.pitwall.data.type.WeatherCondition;

public record SimulateResponse(
        String circuitKey,
        int totalLaps,
        WeatherCondition weatherCondition,
        double rainIntensity,
        Double trackTempC,
        Integer crossoverLap,
        List<StrategyDto> strategies,
        String recommended,
        double deltaS,
        List<String> advisories,
        List<String> guardNotes,
        Map<String, List<RuleHitDto>> ruleHits,
        String model
) {
}

package org.nowstart.pitwall.data.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record StintDto(
        int stintNumber,
        String compound,
        int startLap,
        int endLap,
        int laps,
        double avgLapTimeS,
        double finalLapTimeS,
        double stintTimeS,
        int cliffLaps,
        @JsonProperty("is_wet_tyre")
        boolean wetTyre,
        List<Double> lapTimesS
) {
}

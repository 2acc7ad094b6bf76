package org.nowstart.pitwall.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.nowstart.pitwall.data.type.WeatherCondition;

public record SimulateRequest(
        String circuitKey,
        @NotNull(message = "totalLaps is required")
        @Positive(message = "totalLaps must be greater than zero")
        Integer totalLaps,
        @NotNull(message = "pitLossSeconds is required")
        @DecimalMin(value = "0", message = "pitLossSeconds must not be negative")
        Double pitLossSeconds,
        @NotNull(message = "baseLapTimeS is required")
        @DecimalMin(value = "0", inclusive = false, message = "baseLapTimeS must be greater than zero")
        Double baseLapTimeS,
        Double trackTempC,
        @NotNull(message = "weatherCondition is required")
        WeatherCondition weatherCondition,
        @DecimalMin(value = "0", message = "rainIntensity must be between 0 and 1")
        @DecimalMax(value = "1", message = "rainIntensity must be between 0 and 1")
        Double rainIntensity,
        Map<String, @Valid @NotNull(message = "compound parameters are required") CompoundParamsRequest> compounds,
        Map<String, String> compoundRoles,
        @Valid
        HistoricalProfileRequest historicalProfile
) {
}

package org.nowstart.pitwall.data.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CompoundParamsRequest(
        @JsonProperty("avg_deg_s_per_lap")
        @NotNull(message = "avg_deg_s_per_lap is required")
        @DecimalMin(value = "0", message = "avg_deg_s_per_lap must not be negative")
        Double avgDegSPerLap,
        @NotNull(message = "cliffOnsetLap is required")
        @Min(value = 0, message = "cliffOnsetLap must not be negative")
        Integer cliffOnsetLap,
        @JsonProperty("cliff_rate_s_per_lap2")
        @NotNull(message = "cliff_rate_s_per_lap2 is required")
        @DecimalMin(value = "0", message = "cliff_rate_s_per_lap2 must not be negative")
        Double cliffRateSPerLap2,
        @NotNull(message = "typicalMaxStintLaps is required")
        @Positive(message = "typicalMaxStintLaps must be greater than zero")
        Integer typicalMaxStintLaps,
        Double basePaceOffset,
        @DecimalMin(value = "0", message = "tempMultiplier must not be negative")
        Double tempMultiplier
) {
}

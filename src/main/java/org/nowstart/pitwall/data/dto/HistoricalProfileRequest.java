package org.nowstart.pitwall.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record HistoricalProfileRequest(
        String circuitKey,
        @Valid
        FirstStopLap firstStopLap,
        @Valid
        StopCountDistribution stopCountDistribution,
        List<@Valid @NotNull StrategySequence> commonStrategySequences,
        @Valid
        UndercutOvercut undercutOvercut
) {

    public record FirstStopLap(
            @NotNull(message = "firstStopLap.median is required")
            Double median,
            @NotNull(message = "firstStopLap.p25 is required")
            Double p25,
            @NotNull(message = "firstStopLap.p75 is required")
            Double p75,
            @Min(value = 0, message = "firstStopLap.n must not be negative")
            int n
    ) {
    }

    public record StopCountDistribution(
            @DecimalMin("0") @DecimalMax("100") double oneStopPct,
            @DecimalMin("0") @DecimalMax("100") double twoStopPct,
            @DecimalMin("0") @DecimalMax("100") double threePlusPct,
            @Min(0) int n
    ) {
    }

    public record StrategySequence(
            @Min(0) int stops,
            @NotEmpty(message = "sequence must not be empty")
            List<@NotBlank(message = "sequence codes must not be blank") String> sequence,
            @DecimalMin("0") @DecimalMax("100") double frequencyPct,
            @Min(0) int n
    ) {
    }

    public record UndercutOvercut(
            @Min(0) int undercutAttempts,
            @DecimalMin("0") @DecimalMax("1") double undercutSuccessRate,
            @Min(0) int overcutAttempts,
            @DecimalMin("0") @DecimalMax("1") double overcutSuccessRate,
            double typicalUndercutGainS
    ) {
    }
}

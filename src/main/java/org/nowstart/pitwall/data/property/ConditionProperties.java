package org.nowstart.pitwall.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record ConditionProperties(
        @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal paceFactor,
        @NotNull @DecimalMin("0") BigDecimal crossoverFactor,
        @Min(1) int crossoverMinLap,
        @Min(0) int crossoverTailLaps,
        @NotNull @DecimalMin("0") @DecimalMax("1.0") BigDecimal residualWetness
) {

    public static ConditionProperties of(
            double paceFactor,
            double crossoverFactor,
            int crossoverMinLap,
            int crossoverTailLaps,
            double residualWetness
    ) {
        return new ConditionProperties(
                BigDecimal.valueOf(paceFactor),
                BigDecimal.valueOf(crossoverFactor),
                crossoverMinLap,
                crossoverTailLaps,
                BigDecimal.valueOf(residualWetness)
        );
    }
}

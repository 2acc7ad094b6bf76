package org.nowstart.pitwall.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record TyreWindowProperties(
        @NotNull @DecimalMin("0") @DecimalMax("1.0") BigDecimal lowerWetness,
        @NotNull @DecimalMin("0") @DecimalMax("1.0") BigDecimal upperWetness,
        @NotNull @DecimalMin("0") BigDecimal overheatRateS,
        @NotNull @DecimalMin("0") BigDecimal floodRateS
) {

    public TyreWindowProperties {
        if (lowerWetness != null && upperWetness != null && lowerWetness.compareTo(upperWetness) > 0) {
            throw new IllegalArgumentException("lowerWetness must be <= upperWetness");
        }
    }

    public static TyreWindowProperties of(double lowerWetness, double upperWetness, double overheatRateS, double floodRateS) {
        return new TyreWindowProperties(
                BigDecimal.valueOf(lowerWetness),
                BigDecimal.valueOf(upperWetness),
                BigDecimal.valueOf(overheatRateS),
                BigDecimal.valueOf(floodRateS)
        );
    }
}

package org.nowstart.pitwall.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.bind.DefaultValue;

public record TemperatureProperties(
        // 온도 배수가 없는 컴파운드에 대해 노면 온도로 배수를 추정할지 여부
        @DefaultValue("true") boolean deriveMultiplier,
        // 배수 1.0이 되는 기준 노면 온도(°C)
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("25") BigDecimal referenceTempC,
        // (temp / reference) ^ exponent
        @NotNull @DecimalMin("0") @DefaultValue("1.2") BigDecimal exponent,
        // C 번호 1단계당 추가 민감도(C3 기준)
        @NotNull @DecimalMin("0") @DefaultValue("0.05") BigDecimal softnessSensitivity
) {

    public static TemperatureProperties defaults() {
        return new TemperatureProperties(
                true,
                new BigDecimal("25"),
                new BigDecimal("1.2"),
                new BigDecimal("0.05")
        );
    }
}

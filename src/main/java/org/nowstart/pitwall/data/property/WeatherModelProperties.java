package org.nowstart.pitwall.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import org.nowstart.pitwall.data.type.TyreClass;
import org.nowstart.pitwall.data.type.WeatherCondition;

public record WeatherModelProperties(
        // 노면 상태별 페이스 배수/크로스오버 파라미터
        @Valid @NotNull ConditionProperties dry,
        @Valid @NotNull ConditionProperties damp,
        @Valid @NotNull ConditionProperties wet,
        @Valid @NotNull ConditionProperties extreme,
        // 타이어 종류별 적정 노면 수분 범위
        @Valid @NotNull TyreWindowProperties slick,
        @Valid @NotNull TyreWindowProperties intermediate,
        @Valid @NotNull TyreWindowProperties fullWet,
        // 크로스오버 이후 웻 타이어 과열 누적 패널티(초/랩)
        @NotNull @DecimalMin("0") BigDecimal overheatRampSPerLap,
        // WET 노면에서 풀웻 스타트를 고려할 강우 강도 하한
        @NotNull @DecimalMin("0") @DecimalMax("1.0") BigDecimal fullWetStartIntensity,
        // WET 노면에서 슬릭 크로스오버를 허용할 강우 강도 상한(미만)
        @NotNull @DecimalMin("0") @DecimalMax("1.0") BigDecimal slickCrossoverMaxIntensity
) {

    public static WeatherModelProperties defaults() {
        return new WeatherModelProperties(
                ConditionProperties.of(1.00, 0.0, 1, 0, 0.0),
                ConditionProperties.of(1.06, 0.5, 5, 10, 0.0),
                ConditionProperties.of(1.15, 0.7, 10, 5, 0.2),
                ConditionProperties.of(1.35, 0.8, 10, 5, 0.5),
                TyreWindowProperties.of(0.0, 0.05, 0.0, 25.0),
                TyreWindowProperties.of(0.15, 0.6, 4.0, 15.0),
                TyreWindowProperties.of(0.6, 1.0, 6.0, 0.0),
                new BigDecimal("0.2"),
                new BigDecimal("0.5"),
                new BigDecimal("0.6")
        );
    }

    public ConditionProperties condition(WeatherCondition condition) {
        return switch (condition) {
            case DRY -> dry;
            case DAMP -> damp;
            case WET -> wet;
            case EXTREME -> extreme;
        };
    }

    public TyreWindowProperties window(TyreClass tyreClass) {
        return switch (tyreClass) {
            case SLICK -> slick;
            case INTERMEDIATE -> intermediate;
            case FULL_WET -> fullWet;
        };
    }
}

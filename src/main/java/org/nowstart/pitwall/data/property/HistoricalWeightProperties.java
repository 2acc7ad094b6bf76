package org.nowstart.pitwall.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.bind.DefaultValue;

public record HistoricalWeightProperties(
        // 과거 보정 총합 상한(초, 절대값)
        @NotNull @DecimalMin("0") @DefaultValue("2.0") BigDecimal adjustmentCapS,
        // 전체 보정 배수(0이면 비활성)
        @NotNull @DecimalMin("0") @DefaultValue("1.0") BigDecimal masterWeight,
        // 첫 피트 랩이 IQR 밖일 때 랩당 패널티
        @NotNull @DecimalMin("0") @DefaultValue("0.15") BigDecimal firstStopPenaltyPerLapS,
        // 첫 피트 패널티 상한
        @NotNull @DecimalMin("0") @DefaultValue("2.0") BigDecimal firstStopMaxPenaltyS,
        // 과거 컴파운드 순서 일치 보너스(빈도 100% 기준)
        @NotNull @DecimalMin("0") @DefaultValue("1.5") BigDecimal sequenceMatchBonusS,
        // 순서만 다른 부분 일치 배수
        @NotNull @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.4") BigDecimal sequencePartialMatchFactor,
        // 지배적 피트스톱 횟수 일치 보너스
        @NotNull @DecimalMin("0") @DefaultValue("0.5") BigDecimal stopCountAlignmentBonusS,
        // 지배적 피트스톱 횟수로 인정할 최소 비율(%)
        @NotNull @DecimalMin("0") @DecimalMax("100") @DefaultValue("40") BigDecimal dominantStopCountMinPct,
        // 언더컷/오버컷 성공률 기반 보정 가중치
        @NotNull @DecimalMin("0") @DefaultValue("1.0") BigDecimal undercutWeightS
) {

    public static HistoricalWeightProperties defaults() {
        return new HistoricalWeightProperties(
                new BigDecimal("2.0"),
                new BigDecimal("1.0"),
                new BigDecimal("0.15"),
                new BigDecimal("2.0"),
                new BigDecimal("1.5"),
                new BigDecimal("0.4"),
                new BigDecimal("0.5"),
                new BigDecimal("40"),
                new BigDecimal("1.0")
        );
    }

    public HistoricalWeightProperties withAdjustmentCapS(double capS) {
        return new HistoricalWeightProperties(
                BigDecimal.valueOf(capS),
                masterWeight,
                firstStopPenaltyPerLapS,
                firstStopMaxPenaltyS,
                sequenceMatchBonusS,
                sequencePartialMatchFactor,
                stopCountAlignmentBonusS,
                dominantStopCountMinPct,
                undercutWeightS
        );
    }
}

package org.nowstart.pitwall.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.util.List;
import org.nowstart.pitwall.data.type.MissingCompoundPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pitwall.simulation")
public record SimulationProperties(
        // 탐색할 피트스톱 횟수 목록(0~3)
        @NotEmpty @DefaultValue({"0", "1", "2"}) List<@NotNull @Min(0) @Max(3) Integer> stopCounts,
        // 스틴트 경계 로컬 탐색 반경(랩)
        @Min(0) @Max(5) @DefaultValue("2") int boundarySearchRadius,
        // 후보 분할 시 스틴트 길이 간격(랩)
        @Positive @DefaultValue("5") int partitionStepLaps,
        // 스틴트 최소 랩 수
        @Positive @DefaultValue("5") int minStintLaps,
        // typical_max_stint_laps 초과 허용 비율(0이면 초과 불가)
        @DecimalMin("0") @DefaultValue("0.3") BigDecimal maxStintOverrunRatio,
        // 피트스톱 횟수별 응답에 포함할 최대 전략 수
        @Positive @DefaultValue("3") int maxStrategiesPerStopCount,
        // 후보 시뮬레이션 병렬도(1이면 순차 실행)
        @Positive @DefaultValue("1") int parallelism,
        // 웻 타이어 파라미터 누락 시 처리 정책
        @NotNull @DefaultValue("FALLBACK") MissingCompoundPolicy missingCompoundPolicy,
        // 과거 통계 기반 보정 가중치
        @Valid @NotNull @DefaultValue HistoricalWeightProperties historical,
        // 노면 상태/크로스오버 모델
        @Valid @NotNull WeatherModelProperties weather,
        // 노면 온도 배수 추정
        @Valid @NotNull @DefaultValue TemperatureProperties temperature
) {

    public static SimulationProperties defaults() {
        return new SimulationProperties(
                List.of(0, 1, 2),
                2,
                5,
                5,
                new BigDecimal("0.3"),
                3,
                1,
                MissingCompoundPolicy.FALLBACK,
                HistoricalWeightProperties.defaults(),
                WeatherModelProperties.defaults(),
                TemperatureProperties.defaults()
        );
    }

    public int maxStopCount() {
        return stopCounts.stream().mapToInt(Integer::intValue).max().orElse(0);
    }
}

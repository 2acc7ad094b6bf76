package org.nowstart.pitwall.strategy.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.nowstart.pitwall.data.property.SimulationProperties;
import org.nowstart.pitwall.data.type.TyreClass;
import org.nowstart.pitwall.data.type.WeatherCondition;
import org.nowstart.pitwall.strategy.core.RaceConfig;
import org.nowstart.pitwall.strategy.core.WeatherState;

class TrackWetnessModelTest {

    private final TrackWetnessModel model = new TrackWetnessModel(SimulationProperties.defaults());
    private final RaceConfig race = RaceConfig.of(58, 22.0, 90.0);

    @Test
    void crossoverLap_isNullInDryConditions() {
        assertThat(model.crossoverLap(race, WeatherState.DRY)).isNull();
    }

    @Test
    void crossoverLap_scalesWithIntensityAndConditionFactor() {
        assertThat(model.crossoverLap(race, new WeatherState(WeatherCondition.DAMP, 0.4))).isEqualTo(11);
        assertThat(model.crossoverLap(race, new WeatherState(WeatherCondition.WET, 0.6))).isEqualTo(24);
        assertThat(model.crossoverLap(race, new WeatherState(WeatherCondition.EXTREME, 1.0))).isEqualTo(46);
    }

    @Test
    void crossoverLap_respectsMinimumLapAndTail() {
        assertThat(model.crossoverLap(race, new WeatherState(WeatherCondition.WET, 0.1))).isEqualTo(10);
        assertThat(model.crossoverLap(RaceConfig.of(16, 22.0, 90.0), new WeatherState(WeatherCondition.DAMP, 1.0))).isEqualTo(6);
        assertThat(model.crossoverLap(RaceConfig.of(8, 22.0, 90.0), new WeatherState(WeatherCondition.WET, 0.5))).isEqualTo(7);
    }

    @Test
    void crossoverLap_neverMovesEarlierWithMoreRain() {
        for (WeatherCondition condition : new WeatherCondition[] {WeatherCondition.DAMP, WeatherCondition.WET, WeatherCondition.EXTREME}) {
            int previous = 0;
            for (int step = 0; step <= 20; step++) {
                int lap = model.crossoverLap(race, new WeatherState(condition, step / 20.0));
                assertThat(lap).isGreaterThanOrEqualTo(previous);
                previous = lap;
            }
        }
    }

    @Test
    void wetnessAt_dropsToResidualAfterCrossover() {
        WeatherState weather = new WeatherState(WeatherCondition.WET, 0.6);

        assertThat(model.wetnessAt(24, weather, 24)).isEqualTo(0.6);
        assertThat(model.wetnessAt(25, weather, 24)).isCloseTo(0.12, within(1e-9));
        assertThat(model.wetnessAt(25, WeatherState.DRY, null)).isZero();
    }

    @Test
    void penalty_chargesTyresOutsideTheirWindow() {
        WeatherState weather = new WeatherState(WeatherCondition.WET, 0.6);

        assertThat(model.penalty(TyreClass.SLICK, 0.6, 0, weather)).isCloseTo(13.75, within(1e-9));
        assertThat(model.penalty(TyreClass.INTERMEDIATE, 0.3, 0, weather)).isZero();
        assertThat(model.penalty(TyreClass.FULL_WET, 0.12, 0, weather)).isCloseTo(2.88, within(1e-9));
    }

    @Test
    void penalty_rampsForWetTyresLeftOutAfterCrossover() {
        WeatherState weather = new WeatherState(WeatherCondition.WET, 0.6);

        assertThat(model.penalty(TyreClass.INTERMEDIATE, 0.12, 3, weather)).isCloseTo(0.12 + 0.6, within(1e-9));
        assertThat(model.penalty(TyreClass.SLICK, 0.0, 3, weather)).isZero();
    }

    @Test
    void penalty_isZeroInDryConditions() {
        assertThat(model.penalty(TyreClass.INTERMEDIATE, 0.0, 10, WeatherState.DRY)).isZero();
    }

    @Test
    void paceFactor_keepsDryTimingUnscaled() {
        assertThat(model.paceFactor(WeatherCondition.DRY)).isEqualTo(1.0);
        assertThat(model.paceFactor(WeatherCondition.EXTREME)).isEqualTo(1.35);
    }
}

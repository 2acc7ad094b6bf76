package org.nowstart.pitwall.strategy.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.nowstart.pitwall.data.exception.InvalidCompoundParamsException;
import org.nowstart.pitwall.strategy.core.CompoundParams;

class CompoundDegradationModelTest {

    private final CompoundDegradationModel model = new CompoundDegradationModel();
    private final CompoundParams c3 = CompoundParams.of(0.08, 20, 0.01, 25, 0.0);
    private final CompoundParams c4 = CompoundParams.of(0.12, 15, 0.02, 20, 0.0);

    @Test
    void delta_isZeroOnFreshTyre() {
        assertThat(model.delta(c3, 0, null)).isZero();
    }

    @Test
    void delta_isLinearUpToCliffOnset() {
        assertThat(model.delta(c3, 10, null)).isCloseTo(0.8, within(1e-9));
        assertThat(model.delta(c3, 20, null)).isCloseTo(1.6, within(1e-9));
    }

    @Test
    void delta_addsQuadraticTermPastCliff() {
        assertThat(model.delta(c4, 20, null)).isCloseTo(2.4 + 0.5, within(1e-9));
        assertThat(model.isPastCliff(c4, 15)).isFalse();
        assertThat(model.isPastCliff(c4, 16)).isTrue();
    }

    @Test
    void delta_appliesTempMultiplierOnlyWithTrackTemperature() {
        CompoundParams hot = c3.withTempMultiplier(1.5);

        assertThat(model.delta(hot, 10, 40.0)).isCloseTo(1.2, within(1e-9));
        assertThat(model.delta(hot, 10, null)).isCloseTo(0.8, within(1e-9));
        assertThat(model.delta(c3, 10, 40.0)).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void delta_isNonDecreasingInTyreAge() {
        CompoundParams hot = c4.withTempMultiplier(1.3);
        double previous = 0.0;
        for (int lap = 0; lap <= 60; lap++) {
            double delta = model.delta(hot, lap, 45.0);
            assertThat(delta).isGreaterThanOrEqualTo(previous);
            previous = delta;
        }
    }

    @Test
    void delta_rejectsNegativeLap() {
        assertThatThrownBy(() -> model.delta(c3, -1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void compoundParams_rejectsInvalidValues() {
        assertThatThrownBy(() -> CompoundParams.of(-0.1, 20, 0.01, 25, 0.0))
                .isInstanceOf(InvalidCompoundParamsException.class);
        assertThatThrownBy(() -> CompoundParams.of(0.1, -1, 0.01, 25, 0.0))
                .isInstanceOf(InvalidCompoundParamsException.class);
        assertThatThrownBy(() -> CompoundParams.of(0.1, 20, 0.01, 0, 0.0))
                .isInstanceOf(InvalidCompoundParamsException.class)
                .hasMessageContaining("typicalMaxStintLaps");
        assertThatThrownBy(() -> c3.withTempMultiplier(-1.0))
                .isInstanceOf(InvalidCompoundParamsException.class);
    }

    @Test
    void hardStintCap_appliesOverrunRatio() {
        assertThat(c3.hardStintCap(0.3)).isEqualTo(32);
        assertThat(c4.hardStintCap(0.3)).isEqualTo(26);
        assertThat(c4.hardStintCap(0.0)).isEqualTo(20);
    }
}

package org.nowstart.pitwall.data.property;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.pitwall.data.type.MissingCompoundPolicy;
import org.nowstart.pitwall.data.type.TyreClass;
import org.nowstart.pitwall.data.type.WeatherCondition;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

class SimulationPropertiesTest {

    @Test
    void defaults_matchDocumentedValues() {
        SimulationProperties defaults = SimulationProperties.defaults();

        assertThat(defaults.stopCounts()).containsExactly(0, 1, 2);
        assertThat(defaults.maxStopCount()).isEqualTo(2);
        assertThat(defaults.maxStintOverrunRatio()).isEqualByComparingTo("0.3");
        assertThat(defaults.missingCompoundPolicy()).isEqualTo(MissingCompoundPolicy.FALLBACK);
        assertThat(defaults.historical().adjustmentCapS()).isEqualByComparingTo("2.0");
    }

    @Test
    void applicationYaml_bindsToDefaults() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        Binder binder = new Binder(ConfigurationPropertySources.from(sources));

        SimulationProperties bound = binder.bind("pitwall.simulation", SimulationProperties.class).get();
        SimulationProperties defaults = SimulationProperties.defaults();

        assertThat(bound.stopCounts()).isEqualTo(defaults.stopCounts());
        assertThat(bound.boundarySearchRadius()).isEqualTo(defaults.boundarySearchRadius());
        assertThat(bound.partitionStepLaps()).isEqualTo(defaults.partitionStepLaps());
        assertThat(bound.minStintLaps()).isEqualTo(defaults.minStintLaps());
        assertThat(bound.maxStintOverrunRatio()).isEqualByComparingTo(defaults.maxStintOverrunRatio());
        assertThat(bound.maxStrategiesPerStopCount()).isEqualTo(defaults.maxStrategiesPerStopCount());
        assertThat(bound.parallelism()).isEqualTo(defaults.parallelism());
        assertThat(bound.missingCompoundPolicy()).isEqualTo(defaults.missingCompoundPolicy());
        assertThat(bound.historical().firstStopPenaltyPerLapS()).isEqualByComparingTo(defaults.historical().firstStopPenaltyPerLapS());
        assertThat(bound.historical().dominantStopCountMinPct()).isEqualByComparingTo(defaults.historical().dominantStopCountMinPct());
        assertThat(bound.temperature().deriveMultiplier()).isTrue();
        assertThat(bound.temperature().exponent()).isEqualByComparingTo(defaults.temperature().exponent());

        for (WeatherCondition condition : WeatherCondition.values()) {
            ConditionProperties expected = defaults.weather().condition(condition);
            ConditionProperties actual = bound.weather().condition(condition);
            assertThat(actual.paceFactor()).isEqualByComparingTo(expected.paceFactor());
            assertThat(actual.crossoverFactor()).isEqualByComparingTo(expected.crossoverFactor());
            assertThat(actual.crossoverMinLap()).isEqualTo(expected.crossoverMinLap());
            assertThat(actual.crossoverTailLaps()).isEqualTo(expected.crossoverTailLaps());
            assertThat(actual.residualWetness()).isEqualByComparingTo(expected.residualWetness());
        }
        for (TyreClass tyreClass : TyreClass.values()) {
            TyreWindowProperties expected = defaults.weather().window(tyreClass);
            TyreWindowProperties actual = bound.weather().window(tyreClass);
            assertThat(actual.lowerWetness()).isEqualByComparingTo(expected.lowerWetness());
            assertThat(actual.upperWetness()).isEqualByComparingTo(expected.upperWetness());
            assertThat(actual.overheatRateS()).isEqualByComparingTo(expected.overheatRateS());
            assertThat(actual.floodRateS()).isEqualByComparingTo(expected.floodRateS());
        }
        assertThat(bound.weather().slickCrossoverMaxIntensity()).isEqualByComparingTo(defaults.weather().slickCrossoverMaxIntensity());
    }

    @Test
    void tyreWindow_rejectsInvertedRange() {
        assertThatThrownBy(() -> TyreWindowProperties.of(0.7, 0.2, 1.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lowerWetness");
    }
}

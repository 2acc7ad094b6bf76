package org.nowstart.pitwall.strategy.model;

import lombok.RequiredArgsConstructor;
import org.nowstart.pitwall.data.property.ConditionProperties;
import org.nowstart.pitwall.data.property.SimulationProperties;
import org.nowstart.pitwall.data.property.TyreWindowProperties;
import org.nowstart.pitwall.data.property.WeatherModelProperties;
import org.nowstart.pitwall.data.type.TyreClass;
import org.nowstart.pitwall.data.type.WeatherCondition;
import org.nowstart.pitwall.strategy.core.RaceConfig;
import org.nowstart.pitwall.strategy.core.WeatherState;
import org.springframework.stereotype.Component;

/**
 * Track surface state over a wet race.
 *
 * <p>The surface holds the given rain intensity up to the crossover lap and keeps only the
 * condition's residual share afterwards. Each tyre class has a wetness window; running outside
 * it costs time per lap. Wet tyres left out below their window after the crossover also pay a
 * ramp that grows with every lap past the crossover.
 */
@Component
@RequiredArgsConstructor
public class TrackWetnessModel {

    private final SimulationProperties simulationProperties;

    /**
     * Crossover lap for a non-dry race: {@code max(minLap, min(floor(laps * intensity * factor),
     * laps - tail))}, kept inside {@code [1, laps - 1]} where the race allows it.
     *
     * @return crossover lap, or {@code null} in dry conditions
     */
    public Integer crossoverLap(RaceConfig race, WeatherState weather) {
        if (weather.isDry()) {
            return null;
        }
        ConditionProperties condition = weatherModel().condition(weather.condition());
        int totalLaps = race.totalLaps();
        int raw = (int) Math.floor(totalLaps * weather.rainIntensity() * condition.crossoverFactor().doubleValue());
        int lap = Math.max(condition.crossoverMinLap(), Math.min(raw, totalLaps - condition.crossoverTailLaps()));
        lap = Math.min(lap, totalLaps - 1);
        return Math.max(lap, 1);
    }

    public double paceFactor(WeatherCondition condition) {
        return weatherModel().condition(condition).paceFactor().doubleValue();
    }

    public double wetnessAt(int raceLap, WeatherState weather, Integer crossoverLap) {
        if (weather.isDry()) {
            return 0.0;
        }
        if (crossoverLap == null || raceLap <= crossoverLap) {
            return weather.rainIntensity();
        }
        double residual = weatherModel().condition(weather.condition()).residualWetness().doubleValue();
        return weather.rainIntensity() * residual;
    }

    /**
     * Seconds lost on one lap by a tyre class on a surface of the given wetness.
     *
     * @param tyreClass         tyre class of the running compound
     * @param wetness           surface wetness on this lap, 0 (dry line) to 1 (standing water)
     * @param lapsPastCrossover laps completed since the crossover, 0 before it
     * @param weather           race weather; dry races never pay a penalty
     */
    public double penalty(TyreClass tyreClass, double wetness, int lapsPastCrossover, WeatherState weather) {
        if (weather.isDry()) {
            return 0.0;
        }
        TyreWindowProperties window = weatherModel().window(tyreClass);
        double lower = window.lowerWetness().doubleValue();
        double upper = window.upperWetness().doubleValue();

        double penalty = Math.max(0.0, lower - wetness) * window.overheatRateS().doubleValue()
                + Math.max(0.0, wetness - upper) * window.floodRateS().doubleValue();
        if (tyreClass.isWetTyre() && lapsPastCrossover > 0 && wetness < lower) {
            penalty += weatherModel().overheatRampSPerLap().doubleValue() * lapsPastCrossover;
        }
        return penalty;
    }

    private WeatherModelProperties weatherModel() {
        return simulationProperties.weather();
    }
}

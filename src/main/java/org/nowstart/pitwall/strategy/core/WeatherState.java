package org.nowstart.pitwall.strategy.core;

import org.nowstart.pitwall.data.exception.InvalidRaceConfigException;
import org.nowstart.pitwall.data.type.WeatherCondition;

public record WeatherState(
        WeatherCondition condition,
        double rainIntensity
) {

    public static final WeatherState DRY = new WeatherState(WeatherCondition.DRY, 0.0);

    public WeatherState {
        if (condition == null) {
            throw new InvalidRaceConfigException("weather condition is required");
        }
        if (!Double.isFinite(rainIntensity) || rainIntensity < 0.0 || rainIntensity > 1.0) {
            throw new InvalidRaceConfigException("rainIntensity must be in [0.0, 1.0], got " + rainIntensity);
        }
    }

    public boolean isDry() {
        return condition.isDry();
    }
}

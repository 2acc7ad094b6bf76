package org.nowstart.pitwall.data.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum WeatherCondition {
    DRY,
    DAMP,
    WET,
    EXTREME;

    @JsonCreator
    public static WeatherCondition from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("weather condition is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isDry() {
        return this == DRY;
    }
}

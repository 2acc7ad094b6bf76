package org.nowstart.pitwall.strategy.model;

import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.nowstart.pitwall.data.property.SimulationProperties;
import org.nowstart.pitwall.data.property.TemperatureProperties;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TemperatureMultiplierModel {

    static final double MIN_MULTIPLIER = 0.5;
    private static final int NEUTRAL_CODE_NUMBER = 3;

    private final SimulationProperties simulationProperties;

    public boolean enabled() {
        return simulationProperties.temperature().deriveMultiplier();
    }

    public double multiplier(String compoundCode, double trackTempC) {
        TemperatureProperties temperature = simulationProperties.temperature();
        double ratio = Math.max(trackTempC, 0.0) / temperature.referenceTempC().doubleValue();
        double base = Math.pow(ratio, temperature.exponent().doubleValue());
        double sensitivity = 1.0 + temperature.softnessSensitivity().doubleValue() * (codeNumber(compoundCode) - NEUTRAL_CODE_NUMBER);
        double multiplier = Math.max(base * sensitivity, MIN_MULTIPLIER);
        return Math.round(multiplier * 1000.0) / 1000.0;
    }

    private int codeNumber(String compoundCode) {
        if (compoundCode == null) {
            return NEUTRAL_CODE_NUMBER;
        }
        String normalized = compoundCode.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() == 2 && normalized.charAt(0) == 'C' && Character.isDigit(normalized.charAt(1))) {
            return normalized.charAt(1) - '0';
        }
        return NEUTRAL_CODE_NUMBER;
    }
}

package org.nowstart.pitwall.strategy.model;

import org.nowstart.pitwall.data.exception.InvalidRaceConfigException;
import org.springframework.stereotype.Component;

@Component
public class PitLossModel {

    public double cost(double pitLossSeconds, int stops) {
        if (!Double.isFinite(pitLossSeconds) || pitLossSeconds < 0.0) {
            throw new InvalidRaceConfigException("pitLossSeconds must be >= 0, got " + pitLossSeconds);
        }
        if (stops < 0) {
            throw new IllegalArgumentException("stops must be >= 0, got " + stops);
        }
        return pitLossSeconds * stops;
    }
}

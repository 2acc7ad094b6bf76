package org.nowstart.pitwall.strategy.core;

import org.nowstart.pitwall.data.exception.InvalidRaceConfigException;

public record RaceConfig(
        int totalLaps,
        double pitLossSeconds,
        double baseLapTimeS,
        Double trackTempC,
        String circuitKey
) {

    public RaceConfig {
        if (totalLaps <= 0) {
            throw new InvalidRaceConfigException("totalLaps must be > 0, got " + totalLaps);
        }
        if (!Double.isFinite(pitLossSeconds) || pitLossSeconds < 0.0) {
            throw new InvalidRaceConfigException("pitLossSeconds must be >= 0, got " + pitLossSeconds);
        }
        if (!Double.isFinite(baseLapTimeS) || baseLapTimeS <= 0.0) {
            throw new InvalidRaceConfigException("baseLapTimeS must be > 0, got " + baseLapTimeS);
        }
        if (trackTempC != null && !Double.isFinite(trackTempC)) {
            throw new InvalidRaceConfigException("trackTempC must be finite");
        }
    }

    public static RaceConfig of(int totalLaps, double pitLossSeconds, double baseLapTimeS) {
        return new RaceConfig(totalLaps, pitLossSeconds, baseLapTimeS, null, null);
    }

    public boolean hasTrackTemp() {
        return trackTempC != null;
    }
}

package org.nowstart.pitwall.strategy.core;

import org.nowstart.pitwall.data.exception.InvalidRaceConfigException;

public record FirstStopLapStats(
        double median,
        double p25,
        double p75,
        int n
) {

    public FirstStopLapStats {
        if (p25 > p75) {
            throw new InvalidRaceConfigException("first stop p25 must be <= p75");
        }
    }

    public double iqr() {
        return p75 - p25;
    }
}

package org.nowstart.pitwall.strategy.model;

import org.nowstart.pitwall.strategy.core.CompoundParams;
import org.springframework.stereotype.Component;

@Component
public class CompoundDegradationModel {

    public double delta(CompoundParams params, int lapInStint, Double trackTempC) {
        if (params == null) {
            throw new IllegalArgumentException("compound params are required");
        }
        if (lapInStint < 0) {
            throw new IllegalArgumentException("lapInStint must be >= 0, got " + lapInStint);
        }

        double wear = lapInStint * params.avgDegSPerLap();
        if (isPastCliff(params, lapInStint)) {
            int pastCliff = lapInStint - params.cliffOnsetLap();
            wear += params.cliffRateSPerLap2() * pastCliff * pastCliff;
        }
        // temperature scales wear only, never base pace
        if (trackTempC != null && params.tempMultiplier() != null) {
            wear *= params.tempMultiplier();
        }
        return wear;
    }

    public boolean isPastCliff(CompoundParams params, int lapInStint) {
        return lapInStint > params.cliffOnsetLap();
    }
}

package org.nowstart.pitwall.strategy.core;

import org.nowstart.pitwall.data.exception.InvalidCompoundParamsException;

/**
 * Degradation parameters of one tyre compound.
 *
 * @param avgDegSPerLap       linear degradation rate, seconds per lap of tyre age
 * @param cliffOnsetLap       tyre age after which the quadratic cliff term applies
 * @param cliffRateSPerLap2   quadratic cliff coefficient
 * @param typicalMaxStintLaps stint length after which the compound is considered spent
 * @param basePaceOffset      pace gap to the reference compound, seconds per lap
 * @param tempMultiplier      optional track-temperature multiplier on the degradation term
 */
public record CompoundParams(
        double avgDegSPerLap,
        int cliffOnsetLap,
        double cliffRateSPerLap2,
        int typicalMaxStintLaps,
        double basePaceOffset,
        Double tempMultiplier
) {

    private static final double CAP_EPSILON = 1e-9;

    public CompoundParams {
        requireNonNegative("avgDegSPerLap", avgDegSPerLap);
        requireNonNegative("cliffRateSPerLap2", cliffRateSPerLap2);
        if (cliffOnsetLap < 0) {
            throw new InvalidCompoundParamsException("cliffOnsetLap must be >= 0");
        }
        if (typicalMaxStintLaps <= 0) {
            throw new InvalidCompoundParamsException("typicalMaxStintLaps must be > 0");
        }
        if (!Double.isFinite(basePaceOffset)) {
            throw new InvalidCompoundParamsException("basePaceOffset must be finite");
        }
        if (tempMultiplier != null) {
            requireNonNegative("tempMultiplier", tempMultiplier);
        }
    }

    public static CompoundParams of(
            double avgDegSPerLap,
            int cliffOnsetLap,
            double cliffRateSPerLap2,
            int typicalMaxStintLaps,
            double basePaceOffset
    ) {
        return new CompoundParams(avgDegSPerLap, cliffOnsetLap, cliffRateSPerLap2, typicalMaxStintLaps, basePaceOffset, null);
    }

    public CompoundParams withTempMultiplier(Double multiplier) {
        return new CompoundParams(avgDegSPerLap, cliffOnsetLap, cliffRateSPerLap2, typicalMaxStintLaps, basePaceOffset, multiplier);
    }

    /**
     * Longest stint the search space admits for this compound.
     *
     * @param overrunRatio tolerated share beyond {@link #typicalMaxStintLaps()}
     * @return hard stint cap in laps
     */
    public int hardStintCap(double overrunRatio) {
        return (int) Math.floor(typicalMaxStintLaps * (1.0 + overrunRatio) + CAP_EPSILON);
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidCompoundParamsException(field + " must be finite");
        }
        if (value < 0.0) {
            throw new InvalidCompoundParamsException(field + " must be >= 0");
        }
    }
}

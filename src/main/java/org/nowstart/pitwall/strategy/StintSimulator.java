package org.nowstart.pitwall.strategy;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.pitwall.data.type.TyreClass;
import org.nowstart.pitwall.strategy.core.CompoundParams;
import org.nowstart.pitwall.strategy.core.RaceConditions;
import org.nowstart.pitwall.strategy.core.Stint;
import org.nowstart.pitwall.strategy.model.CompoundDegradationModel;
import org.nowstart.pitwall.strategy.model.TrackWetnessModel;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StintSimulator {

    private final CompoundDegradationModel compoundDegradationModel;
    private final TrackWetnessModel trackWetnessModel;
    private final CompoundCatalogue compoundCatalogue;

    public double[] lapTimes(String compound, CompoundParams params, int startLap, int laps, RaceConditions conditions) {
        TyreClass tyreClass = compoundCatalogue.classify(compound);
        double basePace = conditions.race().baseLapTimeS() * trackWetnessModel.paceFactor(conditions.weather().condition())
                + params.basePaceOffset();
        Double trackTempC = conditions.race().trackTempC();

        double[] times = new double[laps];
        for (int n = 0; n < laps; n++) {
            int raceLap = startLap + n;
            double wetness = trackWetnessModel.wetnessAt(raceLap, conditions.weather(), conditions.crossoverLap());
            double penalty = trackWetnessModel.penalty(
                    tyreClass,
                    wetness,
                    conditions.lapsPastCrossover(raceLap),
                    conditions.weather()
            );
            times[n] = basePace + compoundDegradationModel.delta(params, n, trackTempC) + penalty;
        }
        return times;
    }

    public double stintTime(String compound, CompoundParams params, int startLap, int laps, RaceConditions conditions) {
        double total = 0.0;
        for (double lapTime : lapTimes(compound, params, startLap, laps, conditions)) {
            total += lapTime;
        }
        return total;
    }

    public Stint simulate(int stintNumber, String compound, CompoundParams params, int startLap, int laps, RaceConditions conditions) {
        if (laps <= 0) {
            throw new IllegalArgumentException("stint laps must be > 0, got " + laps);
        }
        double[] times = lapTimes(compound, params, startLap, laps, conditions);
        double total = 0.0;
        List<Double> rounded = new ArrayList<>(laps);
        int cliffLaps = 0;
        for (int n = 0; n < laps; n++) {
            total += times[n];
            rounded.add(Rounding.round3(times[n]));
            if (compoundDegradationModel.isPastCliff(params, n)) {
                cliffLaps++;
            }
        }

        return new Stint(
                stintNumber,
                compound,
                startLap,
                startLap + laps - 1,
                laps,
                Rounding.round3(total),
                Rounding.round3(total / laps),
                Rounding.round3(times[laps - 1]),
                cliffLaps,
                compoundCatalogue.classify(compound).isWetTyre(),
                rounded
        );
    }
}

package org.nowstart.pitwall.strategy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.pitwall.data.property.SimulationProperties;
import org.nowstart.pitwall.strategy.core.CandidateStrategy;
import org.nowstart.pitwall.strategy.core.RaceConditions;
import org.nowstart.pitwall.strategy.core.ResolvedCompounds;
import org.nowstart.pitwall.strategy.core.Stint;
import org.nowstart.pitwall.strategy.core.StintPlan;
import org.nowstart.pitwall.strategy.core.Strategy;
import org.nowstart.pitwall.strategy.model.PitLossModel;
import org.springframework.stereotype.Component;

/**
 * Simulates a candidate and refines its pit boundaries.
 *
 * <p>Starting from the seed partition, every combination of boundary shifts within
 * {@code boundarySearchRadius} laps is tried; the best strict improvement is taken and the search
 * repeats until nothing improves. Shifts are visited from the most negative upwards, so equal
 * totals keep the earlier boundaries.
 */
@Component
@RequiredArgsConstructor
public class StrategySimulator {

    static final int MAX_SEARCH_ITERATIONS = 500;
    private static final double IMPROVEMENT_EPSILON = 1e-9;

    private final SimulationProperties simulationProperties;
    private final StintSimulator stintSimulator;
    private final PitLossModel pitLossModel;

    public Strategy simulate(CandidateStrategy candidate, ResolvedCompounds compounds, RaceConditions conditions) {
        if (candidate.totalLaps() != conditions.race().totalLaps()) {
            throw new IllegalArgumentException(
                    "candidate " + candidate.name() + " covers " + candidate.totalLaps()
                            + " laps, race has " + conditions.race().totalLaps()
            );
        }
        int[] laps = candidate.stints().stream().mapToInt(StintPlan::laps).toArray();
        int[] refined = refine(candidate, laps, compounds, conditions);
        return build(candidate, refined, compounds, conditions);
    }

    public double totalTime(CandidateStrategy candidate, int[] laps, ResolvedCompounds compounds, RaceConditions conditions) {
        double total = pitLossModel.cost(conditions.race().pitLossSeconds(), candidate.stops());
        int startLap = 1;
        for (int i = 0; i < laps.length; i++) {
            String compound = candidate.stints().get(i).compound();
            total += stintSimulator.stintTime(compound, compounds.require(compound), startLap, laps[i], conditions);
            startLap += laps[i];
        }
        return total;
    }

    int[] refine(CandidateStrategy candidate, int[] seed, ResolvedCompounds compounds, RaceConditions conditions) {
        int radius = simulationProperties.boundarySearchRadius();
        int boundaries = seed.length - 1;
        if (boundaries == 0 || radius == 0) {
            return seed;
        }

        int[] current = seed.clone();
        double currentTime = totalTime(candidate, current, compounds, conditions);
        for (int iteration = 0; iteration < MAX_SEARCH_ITERATIONS; iteration++) {
            int[] best = null;
            double bestTime = currentTime;
            int[] shifts = new int[boundaries];
            Arrays.fill(shifts, -radius);
            do {
                int[] moved = shifted(candidate, current, shifts);
                if (moved != null) {
                    double time = totalTime(candidate, moved, compounds, conditions);
                    if (time < bestTime - IMPROVEMENT_EPSILON) {
                        best = moved;
                        bestTime = time;
                    }
                }
            } while (nextShift(shifts, radius));

            if (best == null) {
                break;
            }
            current = best;
            currentTime = bestTime;
        }
        return current;
    }

    private int[] shifted(CandidateStrategy candidate, int[] laps, int[] shifts) {
        int[] moved = new int[laps.length];
        int previousBoundary = 0;
        int boundary = 0;
        for (int i = 0; i < laps.length; i++) {
            boundary += laps[i];
            int newBoundary = i < shifts.length ? boundary + shifts[i] : boundary;
            moved[i] = newBoundary - previousBoundary;
            if (!candidate.stints().get(i).admits(moved[i])) {
                return null;
            }
            previousBoundary = newBoundary;
        }
        return moved;
    }

    private boolean nextShift(int[] shifts, int radius) {
        for (int i = shifts.length - 1; i >= 0; i--) {
            if (shifts[i] < radius) {
                shifts[i]++;
                return true;
            }
            shifts[i] = -radius;
        }
        return false;
    }

    private Strategy build(CandidateStrategy candidate, int[] laps, ResolvedCompounds compounds, RaceConditions conditions) {
        List<Stint> stints = new ArrayList<>(laps.length);
        List<Integer> pitStopLaps = new ArrayList<>();
        int startLap = 1;
        for (int i = 0; i < laps.length; i++) {
            String compound = candidate.stints().get(i).compound();
            Stint stint = stintSimulator.simulate(i + 1, compound, compounds.require(compound), startLap, laps[i], conditions);
            stints.add(stint);
            if (i < laps.length - 1) {
                pitStopLaps.add(stint.endLap());
            }
            startLap += laps[i];
        }

        return new Strategy(
                candidate.name(),
                candidate.stops(),
                Rounding.round3(totalTime(candidate, laps, compounds, conditions)),
                pitStopLaps,
                stints,
                candidate.weatherNote(),
                null,
                List.of()
        );
    }
}

package org.nowstart.pitwall.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pitwall.data.exception.NoLegalStrategyException;
import org.nowstart.pitwall.data.exception.StintLengthExceededException;
import org.nowstart.pitwall.data.property.SimulationProperties;
import org.nowstart.pitwall.data.type.TyreClass;
import org.nowstart.pitwall.data.type.WeatherCondition;
import org.nowstart.pitwall.strategy.core.CandidateStrategy;
import org.nowstart.pitwall.strategy.core.CompoundParams;
import org.nowstart.pitwall.strategy.core.EnumeratedCandidates;
import org.nowstart.pitwall.strategy.core.RaceConfig;
import org.nowstart.pitwall.strategy.core.ResolvedCompounds;
import org.nowstart.pitwall.strategy.core.StintPlan;
import org.nowstart.pitwall.strategy.core.WeatherState;
import org.nowstart.pitwall.strategy.model.TrackWetnessModel;
import org.springframework.stereotype.Component;

/**
 * Builds the legal candidate strategies of a race.
 *
 * <p>A candidate is a compound sequence plus a coarse stint partition. Each stint carries the
 * lap envelope the boundary search may move it within: at least the minimum stint length
 * (the crossover lap for a wet opener) and at most the compound's hard stint cap, or its typical
 * maximum stint for a no-stop candidate. Seeds step through every stint's feasible interval by
 * {@code partitionStepLaps}, always including the interval end.
 *
 * <p>Candidates come out ordered by stop count, then compound sequence, then seed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyEnumerator {

    static final String ARROW = " \u2192 ";

    private final SimulationProperties simulationProperties;
    private final CompoundCatalogue compoundCatalogue;
    private final TrackWetnessModel trackWetnessModel;

    public EnumeratedCandidates enumerate(RaceConfig race, ResolvedCompounds compounds, WeatherState weather) {
        EnumeratedCandidates enumerated = weather.isDry()
                ? enumerateDry(race, compounds)
                : enumerateWet(race, compounds, weather);
        if (enumerated.candidates().isEmpty()) {
            throw new NoLegalStrategyException(String.format(
                    Locale.ROOT,
                    "no legal strategy for %d laps in %s conditions with compounds %s",
                    race.totalLaps(),
                    weather.condition(),
                    compounds.params().keySet()
            ));
        }
        return enumerated;
    }

    private EnumeratedCandidates enumerateDry(RaceConfig race, ResolvedCompounds compounds) {
        List<String> slicks = slicks(compounds);
        List<CandidateStrategy> candidates = new ArrayList<>();
        List<List<String>> singleCompound = new ArrayList<>();

        for (int stops : stopCounts()) {
            for (List<String> sequence : sequences(slicks, stops + 1)) {
                if (sequence.stream().distinct().count() < 2) {
                    singleCompound.add(sequence);
                    continue;
                }
                candidates.addAll(partitionOrDrop(race, compounds, sequence, 0, ""));
            }
        }
        if (!candidates.isEmpty()) {
            return new EnumeratedCandidates(candidates, null, List.of());
        }

        for (List<String> sequence : singleCompound) {
            candidates.addAll(partitionOrDrop(race, compounds, sequence, 0, ""));
        }
        List<String> notes = candidates.isEmpty()
                ? List.of()
                : List.of("No two-compound strategy fits " + race.totalLaps() + " laps; single-compound strategies admitted");
        return new EnumeratedCandidates(candidates, null, notes);
    }

    private EnumeratedCandidates enumerateWet(RaceConfig race, ResolvedCompounds compounds, WeatherState weather) {
        int crossover = trackWetnessModel.crossoverLap(race, weather);
        List<String> slicks = slicks(compounds);
        List<String> post = postCrossoverCompounds(weather, slicks);
        List<String> postSlicks = post.stream().filter(code -> compoundCatalogue.classify(code) == TyreClass.SLICK).toList();
        List<CandidateStrategy> candidates = new ArrayList<>();

        for (int stops : stopCounts()) {
            for (String opener : openers(weather)) {
                if (stops == 0) {
                    candidates.addAll(partitionOrDrop(race, compounds, List.of(opener), crossover, raceNote(weather, opener, null, crossover)));
                } else if (stops == 1) {
                    for (String next : post) {
                        if (!next.equals(opener)) {
                            candidates.addAll(partitionOrDrop(race, compounds, List.of(opener, next), crossover, raceNote(weather, opener, next, crossover)));
                        }
                    }
                } else if (stops == 2) {
                    for (String first : postSlicks) {
                        for (String second : postSlicks) {
                            if (!first.equals(second)) {
                                candidates.addAll(partitionOrDrop(race, compounds, List.of(opener, first, second), crossover, raceNote(weather, opener, first, crossover)));
                            }
                        }
                    }
                }
            }
        }
        return new EnumeratedCandidates(candidates, crossover, List.of());
    }

    List<String> openers(WeatherState weather) {
        double fullWetStart = simulationProperties.weather().fullWetStartIntensity().doubleValue();
        return switch (weather.condition()) {
            case DRY -> List.of();
            case DAMP -> List.of(CompoundCatalogue.INTERMEDIATE);
            case WET -> weather.rainIntensity() > fullWetStart
                    ? List.of(CompoundCatalogue.INTERMEDIATE, CompoundCatalogue.WET)
                    : List.of(CompoundCatalogue.INTERMEDIATE);
            case EXTREME -> List.of(CompoundCatalogue.WET);
        };
    }

    List<String> postCrossoverCompounds(WeatherState weather, List<String> slicks) {
        double slickMax = simulationProperties.weather().slickCrossoverMaxIntensity().doubleValue();
        return switch (weather.condition()) {
            case DRY, DAMP -> slicks;
            case WET -> weather.rainIntensity() < slickMax ? slicks : List.of(CompoundCatalogue.INTERMEDIATE);
            case EXTREME -> List.of(CompoundCatalogue.INTERMEDIATE);
        };
    }

    private String raceNote(WeatherState weather, String opener, String next, int crossover) {
        boolean toSlick = next != null && compoundCatalogue.classify(next) == TyreClass.SLICK;
        if (weather.condition() == WeatherCondition.DAMP) {
            return "Track dries ~lap " + crossover + ". Inters mandatory at start.";
        }
        if (toSlick) {
            return "Late crossover to slicks at ~lap " + crossover;
        }
        if (next != null) {
            return weather.condition() == WeatherCondition.EXTREME
                    ? "Switch to Inters if rain eases"
                    : "Start Full Wets, switch to Inters as rain eases";
        }
        if (CompoundCatalogue.WET.equals(opener)) {
            return weather.condition() == WeatherCondition.EXTREME
                    ? "Extreme rain, Full Wets only"
                    : "Full wet race on full wets";
        }
        return "Full wet race on inters";
    }

    private List<CandidateStrategy> partitionOrDrop(
            RaceConfig race,
            ResolvedCompounds compounds,
            List<String> sequence,
            int openingMinLaps,
            String weatherNote
    ) {
        String name = strategyName(sequence);
        try {
            return partition(race, compounds, sequence, openingMinLaps, name, weatherNote);
        } catch (StintLengthExceededException e) {
            log.debug("event=candidate_dropped strategy=\"{}\" reason=\"{}\"", name, e.getMessage());
            return List.of();
        }
    }

    List<CandidateStrategy> partition(
            RaceConfig race,
            ResolvedCompounds compounds,
            List<String> sequence,
            int openingMinLaps,
            String name,
            String weatherNote
    ) {
        int totalLaps = race.totalLaps();
        double overrun = simulationProperties.maxStintOverrunRatio().doubleValue();
        int stints = sequence.size();
        int[] minLaps = new int[stints];
        int[] maxLaps = new int[stints];
        for (int i = 0; i < stints; i++) {
            CompoundParams params = compounds.require(sequence.get(i));
            // a no-stop race may not overrun the compound's typical life
            maxLaps[i] = stints == 1 ? params.typicalMaxStintLaps() : params.hardStintCap(overrun);
            minLaps[i] = Math.min(Math.min(simulationProperties.minStintLaps(), maxLaps[i]), totalLaps);
        }
        minLaps[0] = Math.max(minLaps[0], openingMinLaps);

        int minSum = 0;
        int maxSum = 0;
        for (int i = 0; i < stints; i++) {
            if (minLaps[i] > maxLaps[i]) {
                throw new StintLengthExceededException(String.format(
                        Locale.ROOT, "%s: opening stint needs %d laps but %s lasts at most %d", name, minLaps[i], sequence.get(i), maxLaps[i]
                ));
            }
            minSum += minLaps[i];
            maxSum += maxLaps[i];
        }
        if (totalLaps < minSum || totalLaps > maxSum) {
            throw new StintLengthExceededException(String.format(
                    Locale.ROOT, "%s: %d laps do not fit stint limits [%d, %d]", name, totalLaps, minSum, maxSum
            ));
        }

        List<int[]> seeds = new ArrayList<>();
        seed(0, totalLaps, new int[stints], minLaps, maxLaps, seeds);

        List<CandidateStrategy> candidates = new ArrayList<>(seeds.size());
        for (int[] seed : seeds) {
            List<StintPlan> plans = new ArrayList<>(stints);
            for (int i = 0; i < stints; i++) {
                plans.add(new StintPlan(sequence.get(i), seed[i], minLaps[i], maxLaps[i]));
            }
            candidates.add(new CandidateStrategy(name, plans, weatherNote));
        }
        return candidates;
    }

    private void seed(int index, int remaining, int[] prefix, int[] minLaps, int[] maxLaps, List<int[]> out) {
        if (index == prefix.length - 1) {
            prefix[index] = remaining;
            out.add(prefix.clone());
            return;
        }
        int restMin = 0;
        int restMax = 0;
        for (int i = index + 1; i < prefix.length; i++) {
            restMin += minLaps[i];
            restMax += maxLaps[i];
        }
        int low = Math.max(minLaps[index], remaining - restMax);
        int high = Math.min(maxLaps[index], remaining - restMin);
        int step = simulationProperties.partitionStepLaps();
        for (int laps = low; laps <= high; laps += step) {
            prefix[index] = laps;
            seed(index + 1, remaining - laps, prefix, minLaps, maxLaps, out);
        }
        if (high >= low && (high - low) % step != 0) {
            prefix[index] = high;
            seed(index + 1, remaining - high, prefix, minLaps, maxLaps, out);
        }
    }

    static String strategyName(List<String> sequence) {
        return (sequence.size() - 1) + "-Stop: " + String.join(ARROW, sequence);
    }

    private List<Integer> stopCounts() {
        return simulationProperties.stopCounts().stream().distinct().sorted().toList();
    }

    private List<String> slicks(ResolvedCompounds compounds) {
        return compounds.params().keySet().stream()
                .filter(code -> compoundCatalogue.classify(code) == TyreClass.SLICK)
                .toList();
    }

    private List<List<String>> sequences(List<String> codes, int length) {
        List<List<String>> out = new ArrayList<>();
        collectSequences(codes, length, new ArrayList<>(), out);
        return out;
    }

    private void collectSequences(List<String> codes, int length, List<String> prefix, List<List<String>> out) {
        if (prefix.size() == length) {
            out.add(List.copyOf(prefix));
            return;
        }
        for (String code : codes) {
            prefix.add(code);
            collectSequences(codes, length, prefix, out);
            prefix.remove(prefix.size() - 1);
        }
    }
}

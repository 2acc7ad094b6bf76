package org.nowstart.pitwall.strategy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pitwall.data.property.SimulationProperties;
import org.nowstart.pitwall.strategy.core.CandidateStrategy;
import org.nowstart.pitwall.strategy.core.EnumeratedCandidates;
import org.nowstart.pitwall.strategy.core.HistoricalProfile;
import org.nowstart.pitwall.strategy.core.RaceConditions;
import org.nowstart.pitwall.strategy.core.RankedResult;
import org.nowstart.pitwall.strategy.core.RankedStrategy;
import org.nowstart.pitwall.strategy.core.ResolvedCompounds;
import org.nowstart.pitwall.strategy.core.RuleHit;
import org.nowstart.pitwall.strategy.core.SimulationInput;
import org.nowstart.pitwall.strategy.core.SimulationResult;
import org.nowstart.pitwall.strategy.core.StintPlan;
import org.nowstart.pitwall.strategy.core.Strategy;
import org.springframework.stereotype.Component;

/**
 * Entry point of the simulation pipeline:
 * resolve compounds, enumerate candidates, pick the fastest seed of every compound sequence,
 * refine it, apply history, rank, truncate per stop count and extract rule hits.
 *
 * <p>Stateless and deterministic. Candidate simulation runs on a dedicated pool when
 * {@code parallelism > 1}; ordering is left to the ranker, so the result does not depend on it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyEngine {

    public static final String MODEL = "piecewise-degradation";

    private static final double SEED_EPSILON = 1e-9;

    private final SimulationProperties simulationProperties;
    private final CompoundCatalogue compoundCatalogue;
    private final StrategyEnumerator strategyEnumerator;
    private final StrategySimulator strategySimulator;
    private final HistoricalAdjuster historicalAdjuster;
    private final StrategyRanker strategyRanker;
    private final RuleExtractor ruleExtractor;

    public SimulationResult simulate(SimulationInput input) {
        ResolvedCompounds compounds = compoundCatalogue.resolve(input);
        EnumeratedCandidates enumerated = strategyEnumerator.enumerate(input.race(), compounds, input.weather());
        RaceConditions conditions = new RaceConditions(input.race(), input.weather(), enumerated.crossoverLap());
        log.debug(
                "event=candidates_enumerated circuit={} condition={} candidates={} crossover_lap={}",
                input.race().circuitKey(),
                input.weather().condition(),
                enumerated.candidates().size(),
                enumerated.crossoverLap()
        );

        List<CandidateStrategy> seeds = bestSeedPerShape(enumerated.candidates(), compounds, conditions);
        log.debug("event=seeds_selected candidates={} shapes={}", enumerated.candidates().size(), seeds.size());

        List<Strategy> simulated = simulateAll(seeds, compounds, conditions);
        HistoricalProfile profile = input.historicalProfile();
        List<Strategy> adjusted = simulated.stream()
                .map(strategy -> strategy.withHistoricalAdjustment(
                        historicalAdjuster.adjust(strategy, profile, input.compoundRoles())
                ))
                .toList();

        RankedResult ranked = truncate(strategyRanker.rank(adjusted));
        List<String> advisories = Stream.concat(compounds.notes().stream(), enumerated.notes().stream()).toList();

        Map<String, List<RuleHit>> ruleHits = new LinkedHashMap<>();
        for (RankedStrategy rankedStrategy : ranked.ranking()) {
            ruleHits.put(
                    rankedStrategy.strategy().name(),
                    ruleExtractor.extract(rankedStrategy, ranked, input.race(), input.weather(), advisories)
            );
        }

        return new SimulationResult(
                input.race(),
                input.weather(),
                enumerated.crossoverLap(),
                ranked,
                ruleHits,
                advisories,
                MODEL
        );
    }

    private List<Strategy> simulateAll(List<CandidateStrategy> candidates, ResolvedCompounds compounds, RaceConditions conditions) {
        int parallelism = simulationProperties.parallelism();
        if (parallelism <= 1) {
            return candidates.stream()
                    .map(candidate -> strategySimulator.simulate(candidate, compounds, conditions))
                    .toList();
        }

        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(() -> candidates.parallelStream()
                    .map(candidate -> strategySimulator.simulate(candidate, compounds, conditions))
                    .toList()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Strategy simulation interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Strategy simulation failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    List<CandidateStrategy> bestSeedPerShape(
            List<CandidateStrategy> candidates,
            ResolvedCompounds compounds,
            RaceConditions conditions
    ) {
        Map<String, CandidateStrategy> bestByShape = new LinkedHashMap<>();
        Map<String, Double> bestTimeByShape = new HashMap<>();
        for (CandidateStrategy candidate : candidates) {
            int[] seedLaps = candidate.stints().stream().mapToInt(StintPlan::laps).toArray();
            double time = strategySimulator.totalTime(candidate, seedLaps, compounds, conditions);
            Double bestTime = bestTimeByShape.get(candidate.shapeKey());
            // earlier seeds win ties
            if (bestTime == null || time < bestTime - SEED_EPSILON) {
                bestByShape.put(candidate.shapeKey(), candidate);
                bestTimeByShape.put(candidate.shapeKey(), time);
            }
        }
        return new ArrayList<>(bestByShape.values());
    }

    RankedResult truncate(RankedResult ranked) {
        int limit = simulationProperties.maxStrategiesPerStopCount();
        Map<Integer, Integer> keptPerStopCount = new LinkedHashMap<>();
        List<RankedStrategy> kept = new ArrayList<>();
        for (RankedStrategy rankedStrategy : ranked.ranking()) {
            int stops = rankedStrategy.strategy().stops();
            int count = keptPerStopCount.merge(stops, 1, Integer::sum);
            if (count <= limit) {
                kept.add(new RankedStrategy(
                        kept.size() + 1,
                        rankedStrategy.strategy(),
                        rankedStrategy.effectiveScoreS(),
                        rankedStrategy.gapToBestS()
                ));
            }
        }
        return new RankedResult(kept, ranked.recommended(), ranked.deltaS(), ranked.guardNotes());
    }
}

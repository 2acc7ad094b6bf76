package org.nowstart.pitwall.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.nowstart.pitwall.strategy.StrategyFixtures.C3;
import static org.nowstart.pitwall.strategy.StrategyFixtures.C4;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.nowstart.pitwall.data.exception.InsufficientCompoundDataException;
import org.nowstart.pitwall.data.exception.InvalidRaceConfigException;
import org.nowstart.pitwall.data.exception.NoLegalStrategyException;
import org.nowstart.pitwall.data.property.SimulationProperties;
import org.nowstart.pitwall.data.type.MissingCompoundPolicy;
import org.nowstart.pitwall.data.type.WeatherCondition;
import org.nowstart.pitwall.strategy.core.CandidateStrategy;
import org.nowstart.pitwall.strategy.core.CompoundParams;
import org.nowstart.pitwall.strategy.core.HistoricalProfile;
import org.nowstart.pitwall.strategy.core.RaceConditions;
import org.nowstart.pitwall.strategy.core.RaceConfig;
import org.nowstart.pitwall.strategy.core.RankedStrategy;
import org.nowstart.pitwall.strategy.core.ResolvedCompounds;
import org.nowstart.pitwall.strategy.core.SimulationInput;
import org.nowstart.pitwall.strategy.core.SimulationResult;
import org.nowstart.pitwall.strategy.core.StintPlan;
import org.nowstart.pitwall.strategy.core.StopCountDistribution;
import org.nowstart.pitwall.strategy.core.Strategy;
import org.nowstart.pitwall.strategy.core.WeatherState;
import org.nowstart.pitwall.strategy.model.PitLossModel;

class StrategyEngineTest {

    private static final CompoundParams C2 = CompoundParams.of(0.05, 25, 0.008, 30, 0.6);

    private final StrategyEngine engine = StrategyFixtures.engine(SimulationProperties.defaults());
    private final SimulationInput dryInput = SimulationInput.of(
            RaceConfig.of(58, 22.0, 90.0),
            WeatherState.DRY,
            Map.of("C3", C3, "C4", C4)
    );

    @Test
    void simulate_dryRaceRanksOneStopSoftToMedium() {
        SimulationResult result = engine.simulate(dryInput);

        assertThat(result.model()).isEqualTo(StrategyEngine.MODEL);
        assertThat(result.crossoverLap()).isNull();
        assertThat(result.advisories()).isEmpty();
        assertThat(result.ranked().strategies())
                .filteredOn(strategy -> strategy.name().equals("1-Stop: C4 → C3"))
                .singleElement()
                .satisfies(strategy -> {
                    assertThat(strategy.totalTimeS()).isEqualTo(5333.44);
                    assertThat(strategy.pitStopLaps()).containsExactly(26);
                });
        assertThat(result.ranked().ranking()).extracting(RankedStrategy::position)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, result.ranked().ranking().size()).boxed().toList());
        assertThat(result.ranked().recommended()).isEqualTo(result.ranked().strategies().get(0).name());
    }

    @Test
    void simulate_respectsPhysicsGuardAcrossRanking() {
        double cap = SimulationProperties.defaults().historical().adjustmentCapS().doubleValue();
        List<Strategy> strategies = engine.simulate(dryInput).ranked().strategies();

        for (int i = 0; i < strategies.size(); i++) {
            for (int j = i + 1; j < strategies.size(); j++) {
                assertThat(strategies.get(i).totalTimeS()).isLessThanOrEqualTo(strategies.get(j).totalTimeS() + cap + 1e-9);
            }
        }
    }

    @Test
    void simulate_keepsAtMostThreeStrategiesPerStopCount() {
        SimulationResult result = engine.simulate(dryInput);

        Map<Integer, Long> perStopCount = result.ranked().strategies().stream()
                .collect(Collectors.groupingBy(Strategy::stops, Collectors.counting()));
        assertThat(perStopCount.values()).allSatisfy(count -> assertThat(count).isLessThanOrEqualTo(3L));
        assertThat(result.ranked().strategies()).extracting(Strategy::name).doesNotHaveDuplicates();
    }

    @Test
    void bestSeedPerShape_keepsFastestSeedOfEachCompoundSequence() {
        SimulationProperties properties = SimulationProperties.defaults();
        RaceConfig race = RaceConfig.of(58, 22.0, 90.0);
        ResolvedCompounds compounds = new ResolvedCompounds(Map.of("C3", C3, "C4", C4), List.of());
        RaceConditions conditions = new RaceConditions(race, WeatherState.DRY, null);
        List<CandidateStrategy> candidates = StrategyFixtures.enumerator(properties)
                .enumerate(race, compounds, WeatherState.DRY)
                .candidates();
        StrategySimulator simulator = StrategyFixtures.strategySimulator(properties);

        List<CandidateStrategy> seeds = engine.bestSeedPerShape(candidates, compounds, conditions);

        assertThat(seeds).extracting(CandidateStrategy::shapeKey)
                .containsExactlyElementsOf(candidates.stream().map(CandidateStrategy::shapeKey).distinct().toList());
        for (CandidateStrategy seed : seeds) {
            double seedTime = simulator.totalTime(seed, seedLaps(seed), compounds, conditions);
            assertThat(candidates)
                    .filteredOn(candidate -> candidate.shapeKey().equals(seed.shapeKey()))
                    .allSatisfy(candidate -> assertThat(simulator.totalTime(candidate, seedLaps(candidate), compounds, conditions))
                            .isGreaterThanOrEqualTo(seedTime - 1e-9));
        }
    }

    @Test
    void simulate_refinesOneSeedPerShapeWithThreeStops() {
        SimulationProperties properties = StrategyFixtures.properties(List.of(0, 1, 2, 3), 0.3, 1, MissingCompoundPolicy.FALLBACK);
        AtomicInteger refined = new AtomicInteger();
        StrategySimulator counting = new StrategySimulator(properties, StrategyFixtures.stintSimulator(properties), new PitLossModel()) {
            @Override
            public Strategy simulate(CandidateStrategy candidate, ResolvedCompounds compounds, RaceConditions conditions) {
                refined.incrementAndGet();
                return super.simulate(candidate, compounds, conditions);
            }
        };
        StrategyEngine threeStops = new StrategyEngine(
                properties,
                StrategyFixtures.catalogue(properties),
                StrategyFixtures.enumerator(properties),
                counting,
                new HistoricalAdjuster(properties),
                new StrategyRanker(properties),
                new RuleExtractor()
        );
        SimulationInput input = SimulationInput.of(
                RaceConfig.of(70, 22.0, 90.0),
                WeatherState.DRY,
                Map.of("C2", C2, "C3", C3, "C4", C4)
        );
        ResolvedCompounds resolved = StrategyFixtures.catalogue(properties).resolve(input);
        List<CandidateStrategy> candidates = StrategyFixtures.enumerator(properties)
                .enumerate(input.race(), resolved, input.weather())
                .candidates();
        long shapes = candidates.stream().map(CandidateStrategy::shapeKey).distinct().count();

        SimulationResult result = threeStops.simulate(input);

        assertThat(candidates.size()).isGreaterThan((int) shapes);
        assertThat(refined.get()).isEqualTo((int) shapes);
        assertThat(result.ranked().strategies()).anySatisfy(strategy -> assertThat(strategy.stops()).isEqualTo(3));
    }

    @Test
    void simulate_keysRuleHitsInRankingOrder() {
        SimulationResult result = engine.simulate(dryInput);

        assertThat(result.ruleHits().keySet())
                .containsExactlyElementsOf(result.ranked().strategies().stream().map(Strategy::name).toList());
        assertThat(result.ruleHits().values()).allSatisfy(hits -> assertThat(hits).isNotEmpty());
    }

    @Test
    void simulate_isIdempotentAndIndependentOfParallelism() {
        StrategyEngine parallel = StrategyFixtures.engine(
                StrategyFixtures.properties(List.of(0, 1, 2), 0.3, 4, MissingCompoundPolicy.FALLBACK)
        );

        SimulationResult first = engine.simulate(dryInput);

        assertThat(engine.simulate(dryInput)).isEqualTo(first);
        assertThat(parallel.simulate(dryInput)).isEqualTo(first);
    }

    @Test
    void simulate_heavyRainOpensOnWetTyresWithDefaultParams() {
        SimulationInput wet = SimulationInput.of(
                RaceConfig.of(58, 22.0, 90.0),
                new WeatherState(WeatherCondition.WET, 0.6),
                Map.of("C3", C3, "C4", C4)
        );

        SimulationResult result = engine.simulate(wet);

        assertThat(result.crossoverLap()).isEqualTo(24);
        assertThat(result.ranked().strategies()).isNotEmpty();
        assertThat(result.ranked().strategies())
                .allSatisfy(strategy -> assertThat(strategy.compounds().get(0)).isIn(CompoundCatalogue.INTERMEDIATE, CompoundCatalogue.WET));
        assertThat(result.advisories())
                .anySatisfy(note -> assertThat(note).startsWith("INTERMEDIATE parameters not supplied"))
                .anySatisfy(note -> assertThat(note).startsWith("WET parameters not supplied"));
    }

    @Test
    void simulate_failPolicyRejectsMissingWetTyres() {
        StrategyEngine strict = StrategyFixtures.engine(
                StrategyFixtures.properties(List.of(0, 1, 2), 0.3, 1, MissingCompoundPolicy.FAIL)
        );
        SimulationInput extreme = SimulationInput.of(
                RaceConfig.of(58, 22.0, 90.0),
                new WeatherState(WeatherCondition.EXTREME, 1.0),
                Map.of("C3", C3, "C4", C4)
        );

        assertThatThrownBy(() -> strict.simulate(extreme)).isInstanceOf(InsufficientCompoundDataException.class);
    }

    @Test
    void simulate_throwsWhenNoStrategyCoversRace() {
        SimulationInput tooLong = SimulationInput.of(RaceConfig.of(100, 22.0, 90.0), WeatherState.DRY, Map.of("C3", C3, "C4", C4));

        assertThatThrownBy(() -> engine.simulate(tooLong)).isInstanceOf(NoLegalStrategyException.class);
    }

    @Test
    void simulate_wetRaceBeyondFullWetLifeHasNoStopFreeStrategy() {
        SimulationInput wet = SimulationInput.of(
                RaceConfig.of(58, 22.0, 90.0),
                new WeatherState(WeatherCondition.WET, 0.6),
                Map.of("C3", C3, "C4", C4)
        );

        SimulationResult result = engine.simulate(wet);

        assertThat(result.ranked().strategies()).extracting(Strategy::name).doesNotContain("0-Stop: WET", "0-Stop: INTERMEDIATE");
    }

    @Test
    void raceConfig_rejectsNonPositiveLaps() {
        assertThatThrownBy(() -> RaceConfig.of(0, 22.0, 90.0))
                .isInstanceOf(InvalidRaceConfigException.class)
                .hasMessageContaining("totalLaps");
    }

    @Test
    void simulate_appliesHistoricalProfileAsMetadata() {
        HistoricalProfile profile = new HistoricalProfile(
                "bahrain", null, new StopCountDistribution(5, 90, 5, 40), List.of(), null
        );
        SimulationInput withHistory = new SimulationInput(
                dryInput.race(), dryInput.weather(), dryInput.compounds(), profile, Map.of()
        );

        SimulationResult plain = engine.simulate(dryInput);
        SimulationResult adjusted = engine.simulate(withHistory);

        assertThat(adjusted.ranked().strategies()).filteredOn(strategy -> strategy.stops() == 2)
                .isNotEmpty()
                .allSatisfy(strategy -> {
                    assertThat(strategy.historicalAdjustmentS()).isEqualTo(-0.45);
                    assertThat(strategy.historicalNotes()).containsExactly("2-stop matches dominant historical pattern (90% of drivers)");
                });
        assertThat(adjusted.ranked().strategies()).filteredOn(strategy -> strategy.stops() != 2)
                .allSatisfy(strategy -> assertThat(strategy.historicalAdjustmentS()).isZero());
        Map<String, Double> plainTotals = plain.ranked().strategies().stream()
                .collect(Collectors.toMap(Strategy::name, Strategy::totalTimeS));
        assertThat(adjusted.ranked().strategies())
                .filteredOn(strategy -> plainTotals.containsKey(strategy.name()))
                .allSatisfy(strategy -> assertThat(strategy.totalTimeS()).isEqualTo(plainTotals.get(strategy.name())));
    }

    private static int[] seedLaps(CandidateStrategy candidate) {
        return candidate.stints().stream().mapToInt(StintPlan::laps).toArray();
    }
}

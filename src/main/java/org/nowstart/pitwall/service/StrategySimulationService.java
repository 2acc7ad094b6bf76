package org.nowstart.pitwall.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.pitwall.data.dto.CompoundParamsRequest;
import org.nowstart.pitwall.data.dto.HistoricalProfileRequest;
import org.nowstart.pitwall.data.dto.RuleHitDto;
import org.nowstart.pitwall.data.dto.SimulateRequest;
import org.nowstart.pitwall.data.dto.SimulateResponse;
import org.nowstart.pitwall.data.dto.StintDto;
import org.nowstart.pitwall.data.dto.StrategyDto;
import org.nowstart.pitwall.strategy.CompoundCatalogue;
import org.nowstart.pitwall.strategy.RuleExtractor;
import org.nowstart.pitwall.strategy.StrategyEngine;
import org.nowstart.pitwall.strategy.core.CompoundParams;
import org.nowstart.pitwall.strategy.core.FirstStopLapStats;
import org.nowstart.pitwall.strategy.core.HistoricalProfile;
import org.nowstart.pitwall.strategy.core.RaceConfig;
import org.nowstart.pitwall.strategy.core.RankedStrategy;
import org.nowstart.pitwall.strategy.core.RuleHit;
import org.nowstart.pitwall.strategy.core.SimulationInput;
import org.nowstart.pitwall.strategy.core.SimulationResult;
import org.nowstart.pitwall.strategy.core.Stint;
import org.nowstart.pitwall.strategy.core.StopCountDistribution;
import org.nowstart.pitwall.strategy.core.Strategy;
import org.nowstart.pitwall.strategy.core.StrategySequence;
import org.nowstart.pitwall.strategy.core.UndercutOvercutStats;
import org.nowstart.pitwall.strategy.core.WeatherState;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StrategySimulationService {

    private final StrategyEngine strategyEngine;
    private final StrategySimulationLogService strategySimulationLogService;

    public SimulateResponse simulate(SimulateRequest request) {
        SimulationResult result = strategyEngine.simulate(toInput(request));
        strategySimulationLogService.logSimulation(result);
        return toResponse(result);
    }

    SimulationInput toInput(SimulateRequest request) {
        RaceConfig race = new RaceConfig(
                request.totalLaps(),
                request.pitLossSeconds(),
                request.baseLapTimeS(),
                request.trackTempC(),
                request.circuitKey()
        );
        WeatherState weather = new WeatherState(
                request.weatherCondition(),
                request.rainIntensity() == null ? 0.0 : request.rainIntensity()
        );

        Map<String, CompoundParams> compounds = new LinkedHashMap<>();
        if (request.compounds() != null) {
            request.compounds().forEach((code, params) -> compounds.put(code, toCompoundParams(params)));
        }

        Map<String, String> roles = new LinkedHashMap<>();
        if (request.compoundRoles() != null) {
            request.compoundRoles().forEach((code, role) -> roles.put(CompoundCatalogue.normalize(code), role));
        }

        return new SimulationInput(race, weather, compounds, toProfile(request.historicalProfile()), roles);
    }

    private CompoundParams toCompoundParams(CompoundParamsRequest request) {
        return new CompoundParams(
                request.avgDegSPerLap(),
                request.cliffOnsetLap(),
                request.cliffRateSPerLap2(),
                request.typicalMaxStintLaps(),
                request.basePaceOffset() == null ? 0.0 : request.basePaceOffset(),
                request.tempMultiplier()
        );
    }

    private HistoricalProfile toProfile(HistoricalProfileRequest request) {
        if (request == null) {
            return null;
        }
        HistoricalProfileRequest.FirstStopLap firstStop = request.firstStopLap();
        HistoricalProfileRequest.StopCountDistribution distribution = request.stopCountDistribution();
        HistoricalProfileRequest.UndercutOvercut undercut = request.undercutOvercut();
        List<StrategySequence> sequences = request.commonStrategySequences() == null
                ? List.of()
                : request.commonStrategySequences().stream()
                        .map(sequence -> new StrategySequence(sequence.stops(), sequence.sequence(), sequence.frequencyPct(), sequence.n()))
                        .toList();

        return new HistoricalProfile(
                request.circuitKey(),
                firstStop == null ? null : new FirstStopLapStats(firstStop.median(), firstStop.p25(), firstStop.p75(), firstStop.n()),
                distribution == null ? null : new StopCountDistribution(
                        distribution.oneStopPct(), distribution.twoStopPct(), distribution.threePlusPct(), distribution.n()
                ),
                sequences,
                undercut == null ? null : new UndercutOvercutStats(
                        undercut.undercutAttempts(),
                        undercut.undercutSuccessRate(),
                        undercut.overcutAttempts(),
                        undercut.overcutSuccessRate(),
                        undercut.typicalUndercutGainS()
                )
        );
    }

    SimulateResponse toResponse(SimulationResult result) {
        List<StrategyDto> strategies = result.ranked().ranking().stream()
                .map(this::toStrategyDto)
                .toList();

        Map<String, List<RuleHitDto>> ruleHits = new LinkedHashMap<>();
        result.ruleHits().forEach((name, hits) -> ruleHits.put(name, hits.stream().map(this::toRuleHitDto).toList()));

        return new SimulateResponse(
                result.race().circuitKey(),
                result.race().totalLaps(),
                result.weather().condition(),
                result.weather().rainIntensity(),
                result.race().trackTempC(),
                result.crossoverLap(),
                strategies,
                result.ranked().recommended(),
                result.ranked().deltaS(),
                result.advisories(),
                result.ranked().guardNotes(),
                ruleHits,
                result.model()
        );
    }

    private StrategyDto toStrategyDto(RankedStrategy ranked) {
        Strategy strategy = ranked.strategy();
        return new StrategyDto(
                ranked.position(),
                strategy.name(),
                strategy.stops(),
                strategy.totalTimeS(),
                RuleExtractor.formatRaceTime(strategy.totalTimeS()),
                ranked.effectiveScoreS(),
                ranked.gapToBestS(),
                strategy.pitStopLaps(),
                strategy.stints().stream().map(this::toStintDto).toList(),
                strategy.weatherNote(),
                strategy.historicalAdjustmentS(),
                strategy.historicalNotes()
        );
    }

    private StintDto toStintDto(Stint stint) {
        return new StintDto(
                stint.stintNumber(),
                stint.compound(),
                stint.startLap(),
                stint.endLap(),
                stint.laps(),
                stint.avgLapTimeS(),
                stint.finalLapTimeS(),
                stint.stintTimeS(),
                stint.cliffLaps(),
                stint.wetTyre(),
                stint.lapTimesS()
        );
    }

    private RuleHitDto toRuleHitDto(RuleHit hit) {
        return new RuleHitDto(hit.category().label(), hit.ruleName(), hit.observedValue(), hit.impact());
    }
}

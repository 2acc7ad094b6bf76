package org.nowstart.pitwall.service;

import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pitwall.strategy.core.RankedResult;
import org.nowstart.pitwall.strategy.core.RankedStrategy;
import org.nowstart.pitwall.strategy.core.SimulationResult;
import org.nowstart.pitwall.strategy.core.Strategy;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class StrategySimulationLogService {

    public void logSimulation(SimulationResult result) {
        RankedResult ranked = result.ranked();

        log.info(
                "event=strategy_simulation circuit={} total_laps={} condition={} rain_intensity={} track_temp_c={} crossover_lap={} strategies={} recommended=\"{}\" delta_s={} advisories={} guard_notes={} model={}",
                result.race().circuitKey(),
                result.race().totalLaps(),
                result.weather().condition(),
                result.weather().rainIntensity(),
                result.race().trackTempC(),
                result.crossoverLap(),
                ranked.ranking().size(),
                escape(ranked.recommended()),
                sanitizeMetricForLog(ranked.deltaS()),
                result.advisories().size(),
                ranked.guardNotes().size(),
                result.model()
        );

        for (RankedStrategy rankedStrategy : ranked.ranking()) {
            Strategy strategy = rankedStrategy.strategy();
            log.info(
                    "event=strategy_ranked circuit={} position={} name=\"{}\" stops={} pit_stop_laps={} total_time_s={} effective_score_s={} gap_to_best_s={} historical_adjustment_s={}",
                    result.race().circuitKey(),
                    rankedStrategy.position(),
                    escape(strategy.name()),
                    strategy.stops(),
                    strategy.pitStopLaps().stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]")),
                    sanitizeMetricForLog(strategy.totalTimeS()),
                    sanitizeMetricForLog(rankedStrategy.effectiveScoreS()),
                    sanitizeMetricForLog(rankedStrategy.gapToBestS()),
                    strategy.historicalAdjustmentS()
            );
        }

        for (String note : ranked.guardNotes()) {
            log.info("event=physics_guard circuit={} note=\"{}\"", result.race().circuitKey(), escape(note));
        }
    }

    private String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private double sanitizeMetricForLog(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return value == -0.0 ? 0.0 : value;
    }
}

package org.nowstart.pitwall.strategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.nowstart.pitwall.data.property.SimulationProperties;
import org.nowstart.pitwall.strategy.core.RankedResult;
import org.nowstart.pitwall.strategy.core.RankedStrategy;
import org.nowstart.pitwall.strategy.core.Strategy;
import org.springframework.stereotype.Component;

/**
 * Orders strategies by effective score (total time plus historical adjustment), then fewer
 * stops, then earlier first pit lap, then name.
 *
 * <p>The physics guard runs on top of that order: a position may only go to a strategy whose raw
 * total is within the historical cap of the fastest raw total still unranked. History can
 * therefore break near-ties but never overturn a clear lap-time margin.
 */
@Component
@RequiredArgsConstructor
public class StrategyRanker {

    static final Comparator<Strategy> ORDER = Comparator
            .comparingDouble(Strategy::effectiveScoreS)
            .thenComparingInt(Strategy::stops)
            .thenComparingInt(Strategy::firstPitLap)
            .thenComparing(Strategy::name);

    private static final double GUARD_EPSILON = 1e-9;

    private final SimulationProperties simulationProperties;

    public RankedResult rank(List<Strategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            return new RankedResult(List.of(), null, 0.0, List.of());
        }
        double cap = simulationProperties.historical().adjustmentCapS().doubleValue();
        List<Strategy> remaining = new ArrayList<>(strategies);
        remaining.sort(ORDER);

        List<Strategy> ordered = new ArrayList<>(remaining.size());
        List<String> guardNotes = new ArrayList<>();
        while (!remaining.isEmpty()) {
            double fastest = remaining.stream().mapToDouble(Strategy::totalTimeS).min().orElseThrow();
            Strategy chosen = remaining.stream()
                    .filter(strategy -> strategy.totalTimeS() <= fastest + cap + GUARD_EPSILON)
                    .findFirst()
                    .orElseThrow();
            Strategy preferred = remaining.get(0);
            if (chosen != preferred) {
                guardNotes.add(String.format(
                        Locale.ROOT,
                        "%s kept behind %s: historical adjustment cannot overturn a %.3fs lap-time deficit",
                        preferred.name(),
                        chosen.name(),
                        preferred.totalTimeS() - chosen.totalTimeS()
                ));
            }
            ordered.add(chosen);
            remaining.remove(chosen);
        }

        double best = ordered.get(0).effectiveScoreS();
        List<RankedStrategy> ranking = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Strategy strategy = ordered.get(i);
            ranking.add(new RankedStrategy(
                    i + 1,
                    strategy,
                    Rounding.round3(strategy.effectiveScoreS()),
                    Rounding.round3(strategy.effectiveScoreS() - best)
            ));
        }
        double deltaS = ordered.size() > 1 ? Rounding.round3(ordered.get(1).effectiveScoreS() - best) : 0.0;
        return new RankedResult(ranking, ordered.get(0).name(), deltaS, guardNotes);
    }
}

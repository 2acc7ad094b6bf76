package org.nowstart.pitwall.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.pitwall.data.property.HistoricalWeightProperties;
import org.nowstart.pitwall.data.property.SimulationProperties;
import org.nowstart.pitwall.strategy.core.FirstStopLapStats;
import org.nowstart.pitwall.strategy.core.HistoricalAdjustment;
import org.nowstart.pitwall.strategy.core.HistoricalProfile;
import org.nowstart.pitwall.strategy.core.StopCountDistribution;
import org.nowstart.pitwall.strategy.core.Strategy;
import org.nowstart.pitwall.strategy.core.StrategySequence;
import org.nowstart.pitwall.strategy.core.UndercutOvercutStats;
import org.springframework.stereotype.Component;

/**
 * Small advisory nudge from circuit history. Positive values penalize, negative values reward.
 * The sum is clamped to {@code adjustmentCapS} so history can only reorder strategies that the
 * lap-time model puts within the cap of each other.
 */
@Component
@RequiredArgsConstructor
public class HistoricalAdjuster {

    private final SimulationProperties simulationProperties;

    public HistoricalAdjustment adjust(Strategy strategy, HistoricalProfile profile, Map<String, String> compoundRoles) {
        if (profile == null) {
            return HistoricalAdjustment.NONE;
        }
        HistoricalWeightProperties weights = simulationProperties.historical();
        double masterWeight = weights.masterWeight().doubleValue();
        if (masterWeight == 0.0) {
            return HistoricalAdjustment.NONE;
        }

        List<String> notes = new ArrayList<>();
        double adjustment = 0.0;
        adjustment += scoreFirstStop(strategy, profile.firstStopLap(), weights, notes);
        adjustment += scoreSequence(strategy, profile.commonSequences(), compoundRoles, weights, notes);
        adjustment += scoreStopCount(strategy, profile.stopCountDistribution(), weights, notes);
        adjustment += scoreUndercut(strategy, profile.firstStopLap(), profile.undercutOvercut(), weights, notes);
        adjustment *= masterWeight;

        double cap = weights.adjustmentCapS().doubleValue();
        boolean capped = Math.abs(adjustment) > cap;
        if (capped) {
            double clamped = Math.copySign(cap, adjustment);
            notes.add(String.format(Locale.ROOT, "Historical adjustment %+.3fs clamped to %+.3fs", adjustment, clamped));
            adjustment = clamped;
        }
        return new HistoricalAdjustment(Rounding.round3(adjustment), notes, capped);
    }

    private double scoreFirstStop(Strategy strategy, FirstStopLapStats firstStop, HistoricalWeightProperties weights, List<String> notes) {
        if (firstStop == null || strategy.stops() < 1) {
            return 0.0;
        }
        int actual = strategy.firstPitLap();
        if (actual >= firstStop.p25() && actual <= firstStop.p75()) {
            notes.add(String.format(
                    Locale.ROOT,
                    "First stop L%d within historical window (L%.0f-L%.0f, median L%.0f, n=%d)",
                    actual, firstStop.p25(), firstStop.p75(), firstStop.median(), firstStop.n()
            ));
            return 0.0;
        }
        double distance = Math.max(firstStop.p25() - actual, actual - firstStop.p75());
        double penalty = Math.min(
                distance * weights.firstStopPenaltyPerLapS().doubleValue(),
                weights.firstStopMaxPenaltyS().doubleValue()
        );
        notes.add(String.format(
                Locale.ROOT,
                "First stop L%d is %.0f laps outside historical IQR (L%.0f-L%.0f), +%.1fs penalty",
                actual, distance, firstStop.p25(), firstStop.p75(), penalty
        ));
        return penalty;
    }

    private double scoreSequence(
            Strategy strategy,
            List<StrategySequence> sequences,
            Map<String, String> compoundRoles,
            HistoricalWeightProperties weights,
            List<String> notes
    ) {
        List<String> roles = strategy.compounds().stream()
                .map(code -> role(code, compoundRoles))
                .toList();
        double bonus = weights.sequenceMatchBonusS().doubleValue();

        for (StrategySequence sequence : sequences) {
            List<String> historical = sequence.sequence().stream().map(code -> code.trim().toUpperCase(Locale.ROOT)).toList();
            if (historical.size() != roles.size()) {
                continue;
            }
            String label = String.join(StrategyEnumerator.ARROW, sequence.sequence());
            if (historical.equals(roles)) {
                notes.add(String.format(Locale.ROOT, "Matches historical sequence %s (%.0f%% of races)", label, sequence.frequencyPct()));
                return -bonus * sequence.frequencyPct() / 100.0;
            }
            if (historical.stream().sorted().toList().equals(roles.stream().sorted().toList())) {
                notes.add(String.format(Locale.ROOT, "Partially matches historical %s (%.0f%%)", label, sequence.frequencyPct()));
                return -bonus * weights.sequencePartialMatchFactor().doubleValue() * sequence.frequencyPct() / 100.0;
            }
        }
        return 0.0;
    }

    private double scoreStopCount(
            Strategy strategy,
            StopCountDistribution distribution,
            HistoricalWeightProperties weights,
            List<String> notes
    ) {
        if (distribution == null) {
            return 0.0;
        }
        int dominant = distribution.twoStopPct() > distribution.oneStopPct() ? 2 : 1;
        double dominantPct = dominant == 2 ? distribution.twoStopPct() : distribution.oneStopPct();
        if (strategy.stops() != dominant || dominantPct <= weights.dominantStopCountMinPct().doubleValue()) {
            return 0.0;
        }
        notes.add(String.format(
                Locale.ROOT,
                "%d-stop matches dominant historical pattern (%.0f%% of drivers)",
                dominant, dominantPct
        ));
        return -weights.stopCountAlignmentBonusS().doubleValue() * dominantPct / 100.0;
    }

    private double scoreUndercut(
            Strategy strategy,
            FirstStopLapStats firstStop,
            UndercutOvercutStats stats,
            HistoricalWeightProperties weights,
            List<String> notes
    ) {
        if (firstStop == null || stats == null || strategy.stops() < 1) {
            return 0.0;
        }
        int actual = strategy.firstPitLap();
        String move;
        int attempts;
        double successRate;
        if (actual < firstStop.p25()) {
            move = "undercut";
            attempts = stats.undercutAttempts();
            successRate = stats.undercutSuccessRate();
        } else if (actual > firstStop.p75()) {
            move = "overcut";
            attempts = stats.overcutAttempts();
            successRate = stats.overcutSuccessRate();
        } else {
            return 0.0;
        }
        if (attempts <= 0) {
            return 0.0;
        }
        double nudge = weights.undercutWeightS().doubleValue() * (0.5 - successRate);
        notes.add(String.format(
                Locale.ROOT,
                "First stop L%d relies on the %s (%.0f%% success over %d attempts), %+.2fs",
                actual, move, successRate * 100.0, attempts, nudge
        ));
        return nudge;
    }

    private String role(String code, Map<String, String> compoundRoles) {
        String normalized = CompoundCatalogue.normalize(code);
        String role = compoundRoles == null ? null : compoundRoles.get(normalized);
        if (role == null && compoundRoles != null) {
            role = compoundRoles.get(code);
        }
        return (role == null ? normalized : role).trim().toUpperCase(Locale.ROOT);
    }
}

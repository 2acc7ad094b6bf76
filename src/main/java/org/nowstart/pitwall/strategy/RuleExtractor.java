package org.nowstart.pitwall.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.nowstart.pitwall.data.type.RuleCategory;
import org.nowstart.pitwall.strategy.core.RaceConfig;
import org.nowstart.pitwall.strategy.core.RankedResult;
import org.nowstart.pitwall.strategy.core.RankedStrategy;
import org.nowstart.pitwall.strategy.core.RuleHit;
import org.nowstart.pitwall.strategy.core.Stint;
import org.nowstart.pitwall.strategy.core.Strategy;
import org.nowstart.pitwall.strategy.core.WeatherState;
import org.springframework.stereotype.Component;

@Component
public class RuleExtractor {

    static final double HIGH_TRACK_TEMP_C = 45.0;
    static final double LOW_TRACK_TEMP_C = 25.0;

    public List<RuleHit> extract(
            RankedStrategy ranked,
            RankedResult result,
            RaceConfig race,
            WeatherState weather,
            List<String> advisories
    ) {
        Strategy strategy = ranked.strategy();
        List<RuleHit> hits = new ArrayList<>();

        hits.add(new RuleHit(
                RuleCategory.WEATHER,
                "Condition",
                weather.condition().name().toLowerCase(Locale.ROOT),
                weather.isDry()
                        ? "Slick tyres only"
                        : "Wet tyres required - rain intensity " + Math.round(weather.rainIntensity() * 100) + "%"
        ));

        if (race.hasTrackTemp()) {
            double temp = race.trackTempC();
            hits.add(new RuleHit(
                    RuleCategory.WEATHER,
                    "Track temperature",
                    format("%.1f°C", temp),
                    temp > HIGH_TRACK_TEMP_C
                            ? "High track temp increases degradation"
                            : temp < LOW_TRACK_TEMP_C ? "Low track temp reduces tyre warm-up" : "Moderate track temperature"
            ));
        }

        hits.add(new RuleHit(
                RuleCategory.STRATEGY,
                "Pit stops",
                Integer.toString(strategy.stops()),
                strategy.stops() == 0
                        ? "No pit stop, full race on one set"
                        : strategy.stops() + " stop(s) at lap" + (strategy.stops() > 1 ? "s " : " ")
                        + strategy.pitStopLaps().stream().map(String::valueOf).collect(Collectors.joining(", "))
        ));

        boolean recommended = strategy.name().equals(result.recommended());
        hits.add(new RuleHit(
                RuleCategory.STRATEGY,
                "Total race time",
                formatRaceTime(strategy.totalTimeS()),
                totalTimeImpact(recommended, result.deltaS(), ranked.gapToBestS())
        ));

        for (Stint stint : strategy.stints()) {
            StringBuilder impact = new StringBuilder(format("Avg %.2fs/lap", stint.avgLapTimeS()));
            if (stint.cliffLaps() > 0) {
                impact.append(", ").append(stint.cliffLaps()).append(" cliff laps (tyre drop-off)");
            }
            if (stint.wetTyre()) {
                impact.append(" [wet tyre]");
            }
            hits.add(new RuleHit(
                    RuleCategory.STINT,
                    "S" + stint.stintNumber() + ": " + stint.compound(),
                    stint.laps() + " laps (L" + stint.startLap() + "-L" + stint.endLap() + ")",
                    impact.toString()
            ));
        }

        if (!strategy.weatherNote().isBlank()) {
            hits.add(new RuleHit(RuleCategory.WEATHER, "Race note", strategy.weatherNote(), "Pre-computed by simulation engine"));
        }

        for (String advisory : advisories) {
            hits.add(new RuleHit(RuleCategory.WEATHER, "Compound data", advisory, "Input substituted or derived by the engine"));
        }

        Double adjustment = strategy.historicalAdjustmentS();
        String historicalImpact = adjustment == null
                ? "Advisory"
                : (adjustment > 0 ? "+" : "") + format("%.1fs adjustment", adjustment);
        for (String note : strategy.historicalNotes()) {
            hits.add(new RuleHit(RuleCategory.HISTORICAL, "Pattern", note, historicalImpact));
        }
        return List.copyOf(hits);
    }

    private static String totalTimeImpact(boolean recommended, double deltaS, double gapToBestS) {
        if (!recommended) {
            return format("%+.1fs off the optimal", gapToBestS);
        }
        if (deltaS < 0) {
            // negative when the physics guard overrode the effective-score order
            return format("Held ahead by physics guard, %.1fs behind on effective score", -deltaS);
        }
        return format("Fastest strategy, wins by %.1fs", deltaS);
    }

    public static String formatRaceTime(double totalSeconds) {
        long millis = Math.round(totalSeconds * 1000.0);
        long hours = millis / 3_600_000L;
        long minutes = (millis % 3_600_000L) / 60_000L;
        long seconds = (millis % 60_000L) / 1000L;
        long fraction = millis % 1000L;
        return format("%d:%02d:%02d.%03d", hours, minutes, seconds, fraction);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}

package org.nowstart.pitwall.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.nowstart.pitwall.data.exception.InsufficientCompoundDataException;
import org.nowstart.pitwall.data.exception.InvalidCompoundParamsException;
import org.nowstart.pitwall.data.property.SimulationProperties;
import org.nowstart.pitwall.data.type.MissingCompoundPolicy;
import org.nowstart.pitwall.data.type.TyreClass;
import org.nowstart.pitwall.data.type.WeatherCondition;
import org.nowstart.pitwall.strategy.core.CompoundParams;
import org.nowstart.pitwall.strategy.core.RaceConfig;
import org.nowstart.pitwall.strategy.core.ResolvedCompounds;
import org.nowstart.pitwall.strategy.core.SimulationInput;
import org.nowstart.pitwall.strategy.core.WeatherState;
import org.nowstart.pitwall.strategy.model.TemperatureMultiplierModel;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CompoundCatalogue {

    public static final String INTERMEDIATE = "INTERMEDIATE";
    public static final String WET = "WET";

    static final CompoundParams DEFAULT_INTERMEDIATE = CompoundParams.of(0.02, 25, 0.005, 40, 2.0);
    static final CompoundParams DEFAULT_WET = CompoundParams.of(0.01, 35, 0.003, 50, 5.0);

    private final SimulationProperties simulationProperties;
    private final TemperatureMultiplierModel temperatureMultiplierModel;

    public static String normalize(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidCompoundParamsException("compound code is required");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return "INTER".equals(normalized) ? INTERMEDIATE : normalized;
    }

    public TyreClass classify(String code) {
        String normalized = normalize(code);
        if (INTERMEDIATE.equals(normalized)) {
            return TyreClass.INTERMEDIATE;
        }
        if (WET.equals(normalized)) {
            return TyreClass.FULL_WET;
        }
        return TyreClass.SLICK;
    }

    /**
     * Wet tyres the enumerator may fit in the given weather, in sorted order.
     */
    public List<String> requiredWetCompounds(WeatherState weather) {
        double fullWetStart = simulationProperties.weather().fullWetStartIntensity().doubleValue();
        return switch (weather.condition()) {
            case DRY -> List.of();
            case DAMP -> List.of(INTERMEDIATE);
            case WET -> weather.rainIntensity() > fullWetStart ? List.of(INTERMEDIATE, WET) : List.of(INTERMEDIATE);
            case EXTREME -> List.of(INTERMEDIATE, WET);
        };
    }

    public ResolvedCompounds resolve(SimulationInput input) {
        RaceConfig race = input.race();
        WeatherState weather = input.weather();
        Map<String, CompoundParams> resolved = new TreeMap<>();
        List<String> notes = new ArrayList<>();

        for (Map.Entry<String, CompoundParams> entry : input.compounds().entrySet()) {
            String code = normalize(entry.getKey());
            CompoundParams params = entry.getValue();
            if (params == null) {
                throw new InvalidCompoundParamsException("parameters for compound " + code + " are required");
            }
            if (resolved.containsKey(code)) {
                throw new InvalidCompoundParamsException("duplicate compound code " + code);
            }
            TyreClass tyreClass = classify(code);
            if (weather.isDry() && tyreClass.isWetTyre()) {
                continue;
            }
            if (tyreClass == TyreClass.SLICK) {
                params = deriveTempMultiplier(code, params, race, notes);
            }
            resolved.put(code, params);
        }

        if (weather.isDry() && resolved.isEmpty()) {
            throw new InsufficientCompoundDataException("at least one slick compound is required in DRY conditions");
        }

        for (String wetCode : requiredWetCompounds(weather)) {
            if (resolved.containsKey(wetCode)) {
                continue;
            }
            if (simulationProperties.missingCompoundPolicy() == MissingCompoundPolicy.FAIL) {
                throw new InsufficientCompoundDataException(
                        wetCode + " parameters are required in " + weather.condition() + " conditions"
                );
            }
            CompoundParams fallback = INTERMEDIATE.equals(wetCode) ? DEFAULT_INTERMEDIATE : DEFAULT_WET;
            resolved.put(wetCode, fallback);
            notes.add(String.format(
                    Locale.ROOT,
                    "%s parameters not supplied; default wet-tyre parameters used (%.3fs/lap, cliff after lap %d)",
                    wetCode,
                    fallback.avgDegSPerLap(),
                    fallback.cliffOnsetLap()
            ));
        }

        if (weather.condition() == WeatherCondition.DAMP && resolved.keySet().stream().noneMatch(code -> classify(code) == TyreClass.SLICK)) {
            notes.add("No slick compounds supplied; the race cannot switch to slicks after the track dries");
        }
        return new ResolvedCompounds(resolved, notes);
    }

    private CompoundParams deriveTempMultiplier(String code, CompoundParams params, RaceConfig race, List<String> notes) {
        if (!race.hasTrackTemp() || params.tempMultiplier() != null || !temperatureMultiplierModel.enabled()) {
            return params;
        }
        double multiplier = temperatureMultiplierModel.multiplier(code, race.trackTempC());
        notes.add(String.format(
                Locale.ROOT,
                "%s temperature multiplier %.3f derived from track temperature %.1f°C",
                code,
                multiplier,
                race.trackTempC()
        ));
        return params.withTempMultiplier(multiplier);
    }
}

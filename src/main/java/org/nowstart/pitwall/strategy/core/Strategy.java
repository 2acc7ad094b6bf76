package org.nowstart.pitwall.strategy.core;

import java.util.List;

/**
 * Fully simulated strategy. {@code historicalAdjustmentS} is advisory metadata and never folded
 * into {@code totalTimeS}.
 */
public record Strategy(
        String name,
        int stops,
        double totalTimeS,
        List<Integer> pitStopLaps,
        List<Stint> stints,
        String weatherNote,
        Double historicalAdjustmentS,
        List<String> historicalNotes
) {

    public Strategy {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("strategy name is required");
        }
        stints = stints == null ? List.of() : List.copyOf(stints);
        pitStopLaps = pitStopLaps == null ? List.of() : List.copyOf(pitStopLaps);
        weatherNote = weatherNote == null ? "" : weatherNote;
        historicalNotes = historicalNotes == null ? List.of() : List.copyOf(historicalNotes);
        if (stops != Math.max(0, stints.size() - 1)) {
            throw new IllegalArgumentException("stops must equal stints - 1");
        }
    }

    public double effectiveScoreS() {
        return totalTimeS + (historicalAdjustmentS == null ? 0.0 : historicalAdjustmentS);
    }

    /**
     * @return first pit lap, or {@link Integer#MAX_VALUE} for a no-stop strategy
     */
    public int firstPitLap() {
        return pitStopLaps.isEmpty() ? Integer.MAX_VALUE : pitStopLaps.get(0);
    }

    public int totalLaps() {
        return stints.stream().mapToInt(Stint::laps).sum();
    }

    public List<String> compounds() {
        return stints.stream().map(Stint::compound).toList();
    }

    public String shapeKey() {
        return String.join(">", compounds());
    }

    public Strategy withHistoricalAdjustment(HistoricalAdjustment adjustment) {
        return new Strategy(
                name,
                stops,
                totalTimeS,
                pitStopLaps,
                stints,
                weatherNote,
                adjustment.adjustmentS(),
                adjustment.notes()
        );
    }
}

package org.nowstart.pitwall.data.dto;

import java.util.List;

public record StrategyDto(
        int rank,
        String name,
        int stops,
        double totalTimeS,
        String totalTimeDisplay,
        double effectiveScoreS,
        double gapToBestS,
        List<Integer> pitStopLaps,
        List<StintDto> stints,
        String weatherNote,
        Double historicalAdjustmentS,
        List<String> historicalNotes
) {
}

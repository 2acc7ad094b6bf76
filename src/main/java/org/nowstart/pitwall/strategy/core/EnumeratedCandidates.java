package org.nowstart.pitwall.strategy.core;

import java.util.List;

public record EnumeratedCandidates(
        List<CandidateStrategy> candidates,
        Integer crossoverLap,
        List<String> notes
) {

    public EnumeratedCandidates {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}

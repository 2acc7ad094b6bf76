package org.nowstart.pitwall.strategy.core;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record ResolvedCompounds(
        Map<String, CompoundParams> params,
        List<String> notes
) {

    public ResolvedCompounds {
        params = Collections.unmodifiableMap(new TreeMap<>(params));
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public CompoundParams require(String code) {
        CompoundParams compound = params.get(code);
        if (compound == null) {
            throw new IllegalArgumentException("no parameters resolved for compound " + code);
        }
        return compound;
    }
}

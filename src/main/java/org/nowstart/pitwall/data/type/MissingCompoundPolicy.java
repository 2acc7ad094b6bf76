package org.nowstart.pitwall.data.type;

public enum MissingCompoundPolicy {
    /**
     * Reject the request with {@code insufficient_compound_data}.
     */
    FAIL,
    /**
     * Substitute built-in default parameters and attach an advisory note.
     */
    FALLBACK
}

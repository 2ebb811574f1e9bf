package com.example.techsewa.semantic;

import java.util.Optional;

/**
 * Embedding-similarity fallback.  Implementations absorb the availability check:
 * callers never need to test {@link #isEnabled()} before calling {@link #search}.
 */
public interface SemanticMatcher {

    double DEFAULT_THRESHOLD = 0.60;

    Optional<SemanticHit> search(String query, String lang, double threshold);

    default Optional<SemanticHit> search(String query, String lang) {
        return search(query, lang, DEFAULT_THRESHOLD);
    }

    /** Capability flag for diagnostics only. */
    boolean isEnabled();
}

package com.example.techsewa.semantic;

import java.util.Optional;

/**
 * Stand-in used when no embedding backend could be created.
 */
public final class NoopSemanticMatcher implements SemanticMatcher {

    public static final NoopSemanticMatcher INSTANCE = new NoopSemanticMatcher();

    private NoopSemanticMatcher() {}

    @Override
    public Optional<SemanticHit> search(String query, String lang, double threshold) {
        return Optional.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}

package com.example.techsewa.match;

/**
 * A local knowledge-base answer.
 *
 * @param score 100 for exact token hits, otherwise the fuzzy score
 */
public record MatchHit(String answer, String recordId, String alias, int score, boolean exact) {
}

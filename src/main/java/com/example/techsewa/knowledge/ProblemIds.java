package com.example.techsewa.knowledge;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.function.Predicate;

/**
 * Short content-derived record ids: first 8 hex chars of the MD5 of the trigger phrase.
 */
public final class ProblemIds {

    private static final int LENGTH = 8;

    private ProblemIds() {}

    public static String forQuery(String query) {
        return DigestUtils.md5Hex(query == null ? "" : query).substring(0, LENGTH);
    }

    /**
     * Derive an id for {@code query} that {@code taken} does not reject, re-hashing with a
     * {@code #n} suffix on collision.
     */
    public static String unique(String query, Predicate<String> taken) {
        String id = forQuery(query);
        int n = 1;
        while (taken.test(id)) {
            id = forQuery(query + "#" + n++);
        }
        return id;
    }
}

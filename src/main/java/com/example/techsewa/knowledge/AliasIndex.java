package com.example.techsewa.knowledge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Per-language lookup from lowercase trigger phrase to the record that owns it.
 * Always a pure function of the record list it was built from; never mutated after {@link #build}.
 * Iteration order is first-insertion order of each alias; a later record claiming the
 * same alias replaces the target but keeps the first position.
 */
public final class AliasIndex {

    private final Map<String, Map<String, ProblemRecord>> byLang;

    private AliasIndex(Map<String, Map<String, ProblemRecord>> byLang) {
        this.byLang = byLang;
    }

    public static AliasIndex build(List<ProblemRecord> records) {
        Map<String, Map<String, ProblemRecord>> tmp = new LinkedHashMap<>();
        for (ProblemRecord r : records) {
            for (String lang : r.aliasLanguages()) {
                Map<String, ProblemRecord> map = tmp.computeIfAbsent(lang, k -> new LinkedHashMap<>());
                for (String alias : r.aliasesFor(lang)) {
                    String key = normalize(alias);
                    if (!key.isEmpty()) {
                        map.put(key, r);
                    }
                }
            }
        }
        Map<String, Map<String, ProblemRecord>> frozen = new LinkedHashMap<>();
        tmp.forEach((lang, map) -> frozen.put(lang, Collections.unmodifiableMap(map)));
        return new AliasIndex(Collections.unmodifiableMap(frozen));
    }

    public static String normalize(String alias) {
        return alias == null ? "" : alias.toLowerCase(Locale.ROOT).strip();
    }

    public Optional<ProblemRecord> exact(String lang, String token) {
        return Optional.ofNullable(entries(lang).get(token));
    }

    /** Read-only view of one language's aliases in scan order. */
    public Map<String, ProblemRecord> entries(String lang) {
        return byLang.getOrDefault(lang, Map.of());
    }

    public int size(String lang) {
        return entries(lang).size();
    }
}

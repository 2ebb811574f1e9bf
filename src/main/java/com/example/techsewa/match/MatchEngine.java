package com.example.techsewa.match;

import com.example.techsewa.common.LruCache;
import com.example.techsewa.knowledge.AliasIndex;
import com.example.techsewa.knowledge.KnowledgeSnapshot;
import com.example.techsewa.knowledge.KnowledgeStore;
import com.example.techsewa.knowledge.ProblemRecord;
import com.example.techsewa.lang.Languages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Exact-token then fuzzy lookup against the store's alias index.
 *
 * <p>A token equal to a known alias always wins, whatever the fuzzy scores are.  Otherwise the
 * alias with the highest {@link TokenSetSimilarity} score is accepted when it reaches the
 * threshold; on equal scores the alias met first in index order is kept.</p>
 *
 * <p>Results are memoised per {@code (query, lang, threshold)} and per store generation;
 * the whole cache is dropped when the store publishes a new snapshot.</p>
 */
public class MatchEngine {
    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    public static final int DEFAULT_MIN_CONFIDENCE = 75;
    public static final int DEFAULT_CACHE_SIZE = 500;

    private final KnowledgeStore store;
    private final int defaultMinConfidence;
    private final LruCache<CacheKey, Optional<MatchHit>> cache;

    public MatchEngine(KnowledgeStore store) {
        this(store, DEFAULT_MIN_CONFIDENCE, DEFAULT_CACHE_SIZE);
    }

    public MatchEngine(KnowledgeStore store, int defaultMinConfidence, int cacheSize) {
        this.store = store;
        this.defaultMinConfidence = defaultMinConfidence;
        this.cache = new LruCache<>(cacheSize);
        store.addListener((snapshot, appended) -> invalidate());
    }

    public Optional<MatchHit> match(String query, String lang) {
        return match(query, lang, null);
    }

    /**
     * @param minConfidence 0-100, values outside are clamped; {@code null} selects the configured default
     */
    public Optional<MatchHit> match(String query, String lang, Integer minConfidence) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String language = Languages.normalize(lang);
        int threshold = minConfidence == null ? defaultMinConfidence : Math.max(0, Math.min(100, minConfidence));
        KnowledgeSnapshot snap = store.snapshot();
        CacheKey key = new CacheKey(query, language, threshold, snap.generation());
        return cache.computeIfAbsent(key, k -> lookup(snap, k.query(), k.lang(), k.threshold()));
    }

    Optional<MatchHit> lookup(KnowledgeSnapshot snap, String query, String lang, int threshold) {
        AliasIndex index = snap.index();
        String q = query.toLowerCase(Locale.ROOT).strip();

        for (String tok : TokenSetSimilarity.tokenize(q)) {
            Optional<ProblemRecord> hit = index.exact(lang, tok);
            if (hit.isPresent()) {
                ProblemRecord r = hit.get();
                log.debug("[MATCH] exact token '{}' -> {}", tok, r.getId());
                return Optional.of(new MatchHit(r.answerFor(lang), r.getId(), tok, 100, true));
            }
        }

        String bestAlias = null;
        ProblemRecord best = null;
        int bestScore = -1;
        for (Map.Entry<String, ProblemRecord> e : index.entries(lang).entrySet()) {
            int s = TokenSetSimilarity.score(q, e.getKey());
            if (s > bestScore) {
                bestScore = s;
                bestAlias = e.getKey();
                best = e.getValue();
            }
        }
        if (best != null && bestScore >= threshold) {
            log.debug("[MATCH] fuzzy '{}' ~ '{}' score={} -> {}", q, bestAlias, bestScore, best.getId());
            return Optional.of(new MatchHit(best.answerFor(lang), best.getId(), bestAlias, bestScore, false));
        }
        return Optional.empty();
    }

    public void invalidate() {
        cache.invalidateAll();
    }

    public int cacheSize() {
        return cache.size();
    }

    public int getDefaultMinConfidence() {
        return defaultMinConfidence;
    }

    private record CacheKey(String query, String lang, int threshold, long generation) {
    }
}

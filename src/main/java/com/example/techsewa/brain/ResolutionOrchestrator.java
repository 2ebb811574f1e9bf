package com.example.techsewa.brain;

import com.example.techsewa.knowledge.KnowledgeStore;
import com.example.techsewa.knowledge.ProblemIds;
import com.example.techsewa.knowledge.ProblemRecord;
import com.example.techsewa.lang.LanguageDetector;
import com.example.techsewa.lang.Languages;
import com.example.techsewa.match.MatchEngine;
import com.example.techsewa.match.MatchHit;
import com.example.techsewa.semantic.SemanticHit;
import com.example.techsewa.semantic.SemanticMatcher;
import com.example.techsewa.web.WebFallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * The help desk's brain.  {@link #solve} tries, in order, the local knowledge base
 * (exact then fuzzy), semantic similarity and the web, and stops at the first answer.
 *
 * <p>{@code solve} is reentrant and may run from several threads at once.  {@link #teach}
 * goes through the store's single-writer path.</p>
 */
public class ResolutionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ResolutionOrchestrator.class);
    private static final Logger unmatched = LoggerFactory.getLogger("techsewa.unmatched");

    public static final String NO_SOLUTION = "❌ No solution found.";

    private final KnowledgeStore store;
    private final MatchEngine matchEngine;
    private final SemanticMatcher semantic;
    private final WebFallback web;
    private final QueryHistory history;
    private final LanguageDetector languageDetector;
    private final Clock clock;
    private final double semanticThreshold;

    /**
     * @param web {@code null} disables the internet step
     */
    public ResolutionOrchestrator(KnowledgeStore store,
                                  MatchEngine matchEngine,
                                  SemanticMatcher semantic,
                                  WebFallback web,
                                  QueryHistory history,
                                  LanguageDetector languageDetector,
                                  Clock clock,
                                  double semanticThreshold) {
        this.store = store;
        this.matchEngine = matchEngine;
        this.semantic = semantic;
        this.web = web;
        this.history = history;
        this.languageDetector = languageDetector;
        this.clock = clock;
        this.semanticThreshold = semanticThreshold;
    }

    public SolveResult solve(String query, String lang) {
        return solve(query, lang, null);
    }

    /**
     * @param lang          {@code en}, {@code np} or {@code auto}
     * @param minConfidence fuzzy threshold 0-100 (clamped), {@code null} for the configured default
     */
    public SolveResult solve(String query, String lang, Integer minConfidence) {
        String text = query == null ? "" : query.strip();
        String language = languageDetector.resolve(lang, text);
        history.record(new QueryHistoryEntry(clock.instant(), text, language));

        SolveResult result;
        try {
            result = cascade(text, language, minConfidence);
        } catch (RuntimeException e) {
            log.error("[BRAIN] resolution failed for '{}'", text, e);
            result = new SolveResult(AnswerSource.NONE, NO_SOLUTION);
        }
        if (result.source() == AnswerSource.INTERNET || result.source() == AnswerSource.NONE) {
            unmatched.info("{}\t{}", language, text);
        }
        log.debug("[BRAIN] '{}' ({}) -> {}", text, language, result.source());
        return result;
    }

    private SolveResult cascade(String query, String lang, Integer minConfidence) {
        if (query.isEmpty()) {
            return new SolveResult(AnswerSource.NONE, NO_SOLUTION);
        }
        Optional<MatchHit> local = matchEngine.match(query, lang, minConfidence);
        if (local.isPresent()) {
            return new SolveResult(AnswerSource.LOCAL, local.get().answer());
        }
        Optional<SemanticHit> sem = semantic.search(query, lang, semanticThreshold);
        if (sem.isPresent()) {
            return new SolveResult(AnswerSource.SEMANTIC, sem.get().answer());
        }
        if (web != null) {
            return new SolveResult(AnswerSource.INTERNET, web.search(query, lang));
        }
        return new SolveResult(AnswerSource.NONE, NO_SOLUTION);
    }

    /**
     * Learn a new answer.  The phrase becomes a trigger in every supported language.
     *
     * @param answerNp may be {@code null} or blank, in which case the English answer is reused
     * @return the stored record
     * @throws com.example.techsewa.knowledge.KnowledgePersistenceException when the record
     *         was accepted in memory but could not be written
     */
    public ProblemRecord teach(String query, String answerEn, String answerNp) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (answerEn == null || answerEn.isBlank()) {
            throw new IllegalArgumentException("answerEn must not be blank");
        }
        String phrase = query.strip();
        ProblemRecord.ProblemRecordBuilder b = ProblemRecord.builder()
                .id(ProblemIds.forQuery(phrase))
                .answer(Languages.EN, answerEn)
                .answer(Languages.NP, (answerNp == null || answerNp.isBlank()) ? answerEn : answerNp)
                .autoFix(false)
                .learned(true);
        for (String l : Languages.SUPPORTED) {
            b.alias(l, List.of(phrase));
        }
        ProblemRecord stored = store.append(b.build());
        log.info("[BRAIN] learned '{}' as {}", phrase, stored.getId());
        return stored;
    }

    public BrainStats stats() {
        return new BrainStats(store.size(), matchEngine.cacheSize(), semantic.isEnabled(), web != null);
    }

    public List<QueryHistoryEntry> history() {
        return history.snapshot();
    }
}

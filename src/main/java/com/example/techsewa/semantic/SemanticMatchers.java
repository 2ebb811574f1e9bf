package com.example.techsewa.semantic;

import com.example.techsewa.knowledge.KnowledgeStore;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Picks the semantic strategy once, at construction time.
 */
public final class SemanticMatchers {
    private static final Logger log = LoggerFactory.getLogger(SemanticMatchers.class);

    private SemanticMatchers() {}

    /**
     * Build an embedding-backed matcher, or the no-op matcher when the backend cannot be
     * created (model classes or native runtime missing, model failing to load or embed).
     */
    public static SemanticMatcher create(Supplier<EmbeddingModel> modelFactory, KnowledgeStore store) {
        try {
            EmbeddingModel model = modelFactory.get();
            if (model == null) {
                log.info("[SEMANTIC] no embedding model configured; semantic search disabled");
                return NoopSemanticMatcher.INSTANCE;
            }
            return new EmbeddingSemanticMatcher(model, store);
        } catch (RuntimeException | LinkageError e) {
            log.warn("[SEMANTIC] embedding backend unavailable; semantic search disabled: {}", e.toString());
            return NoopSemanticMatcher.INSTANCE;
        }
    }
}

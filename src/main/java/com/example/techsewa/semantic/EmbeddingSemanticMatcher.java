package com.example.techsewa.semantic;

import com.example.techsewa.knowledge.KnowledgeSnapshot;
import com.example.techsewa.knowledge.KnowledgeStore;
import com.example.techsewa.knowledge.ProblemRecord;
import com.example.techsewa.lang.Languages;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cosine similarity between the query and the English answer text of every record.
 * The corpus is embedded in one batch on construction; records appended later are
 * embedded one at a time as the store announces them.
 */
public class EmbeddingSemanticMatcher implements SemanticMatcher {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingSemanticMatcher.class);

    private final EmbeddingModel model;
    private final List<Entry> corpus = new CopyOnWriteArrayList<>();

    public EmbeddingSemanticMatcher(EmbeddingModel model, KnowledgeStore store) {
        this.model = model;
        List<ProblemRecord> records = store.records();
        List<TextSegment> segments = new ArrayList<>(records.size());
        for (ProblemRecord r : records) {
            segments.add(TextSegment.from(r.answerFor(Languages.EN)));
        }
        if (!segments.isEmpty()) {
            List<Embedding> vectors = model.embedAll(segments).content();
            List<Entry> batch = new ArrayList<>(records.size());
            for (int i = 0; i < records.size(); i++) {
                batch.add(new Entry(records.get(i), vectors.get(i)));
            }
            corpus.addAll(batch);
        }
        store.addListener(this::onAppend);
        log.info("[SEMANTIC] embedded {} answers", corpus.size());
    }

    void onAppend(KnowledgeSnapshot snapshot, ProblemRecord appended) {
        Embedding e = model.embed(appended.answerFor(Languages.EN)).content();
        corpus.add(new Entry(appended, e));
    }

    @Override
    public Optional<SemanticHit> search(String query, String lang, double threshold) {
        if (query == null || query.isBlank() || corpus.isEmpty()) {
            return Optional.empty();
        }
        Embedding q;
        try {
            q = model.embed(query).content();
        } catch (RuntimeException e) {
            log.warn("[SEMANTIC] query embedding failed: {}", e.toString());
            return Optional.empty();
        }
        Entry best = null;
        double bestSim = Double.NEGATIVE_INFINITY;
        for (Entry e : corpus) {
            double sim = CosineSimilarity.between(q, e.vector());
            if (sim > bestSim) {
                bestSim = sim;
                best = e;
            }
        }
        if (best == null || bestSim < threshold) {
            return Optional.empty();
        }
        log.debug("[SEMANTIC] '{}' -> {} sim={}", query, best.record().getId(), String.format("%.3f", bestSim));
        String language = Languages.normalize(lang);
        return Optional.of(new SemanticHit(best.record().answerFor(language), best.record().getId(), bestSim));
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    int corpusSize() {
        return corpus.size();
    }

    private record Entry(ProblemRecord record, Embedding vector) {
    }
}

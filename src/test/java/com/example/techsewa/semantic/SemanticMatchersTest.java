package com.example.techsewa.semantic;

import com.example.techsewa.knowledge.KnowledgeStore;
import com.example.techsewa.lang.Languages;
import com.example.techsewa.support.TestKnowledge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class SemanticMatchersTest {

    @TempDir
    Path dir;

    private KnowledgeStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = TestKnowledge.store(dir, TestKnowledge.WIFI_AND_PRINTER);
    }

    @Test
    void workingModelGivesEmbeddingMatcher() {
        SemanticMatcher m = SemanticMatchers.create(BagOfWordsEmbeddingModel::new, store);

        assertThat(m).isInstanceOf(EmbeddingSemanticMatcher.class);
    }

    @Test
    void missingModelGivesNoop() {
        assertThat(SemanticMatchers.create(() -> null, store)).isSameAs(NoopSemanticMatcher.INSTANCE);
    }

    @Test
    void brokenBackendGivesNoop() {
        SemanticMatcher failing = SemanticMatchers.create(() -> {
            throw new IllegalStateException("model file missing");
        }, store);
        SemanticMatcher unlinked = SemanticMatchers.create(() -> {
            throw new NoClassDefFoundError("ai/onnxruntime/OrtEnvironment");
        }, store);

        assertThat(failing).isSameAs(NoopSemanticMatcher.INSTANCE);
        assertThat(unlinked).isSameAs(NoopSemanticMatcher.INSTANCE);
        assertThat(failing.isEnabled()).isFalse();
        assertThat(failing.search("restart the router", Languages.EN)).isEmpty();
    }
}

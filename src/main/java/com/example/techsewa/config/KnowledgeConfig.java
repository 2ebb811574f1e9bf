package com.example.techsewa.config;

import com.example.techsewa.knowledge.KnowledgeBaseCodec;
import com.example.techsewa.knowledge.KnowledgeStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
public class KnowledgeConfig {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeConfig.class);

    static final String SEED_RESOURCE = "problems.json";

    @Bean
    public KnowledgeBaseCodec knowledgeBaseCodec(ObjectMapper objectMapper) {
        return new KnowledgeBaseCodec(objectMapper);
    }

    @Bean
    public KnowledgeStore knowledgeStore(TechsewaProperties props, KnowledgeBaseCodec codec) {
        Path path = Path.of(props.getKnowledge().getPath());
        if (!Files.exists(path) && props.getKnowledge().isBootstrapIfMissing()) {
            bootstrap(new ClassPathResource(SEED_RESOURCE), path);
        }
        return KnowledgeStore.load(path, codec);
    }

    static void bootstrap(Resource seed, Path target) {
        if (!seed.exists()) {
            log.warn("[KB] no bundled seed '{}' to bootstrap {}", seed.getDescription(), target);
            return;
        }
        try (InputStream in = seed.getInputStream()) {
            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Files.copy(in, target);
            log.info("[KB] bootstrapped {} from {}", target, seed.getDescription());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not bootstrap knowledge base at " + target, e);
        }
    }
}

package com.example.techsewa.support;

import com.example.techsewa.knowledge.KnowledgeBaseCodec;
import com.example.techsewa.knowledge.KnowledgeStore;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Small knowledge bases written to a temp dir and loaded through the real store. */
public final class TestKnowledge {

    public static final String WIFI_AND_PRINTER = """
            [
              {
                "id": "wifi0001",
                "aliases": ["wifi not working", "no internet"],
                "np_aliases": ["इन्टरनेट छैन"],
                "en": "Restart your router.",
                "np": "राउटर पुनः सुरु गर्नुहोस्।",
                "auto_fix": true
              },
              {
                "id": "prnt0001",
                "aliases": ["printer jam"],
                "en": "Open the tray and remove the stuck paper."
              }
            ]
            """;

    private TestKnowledge() {}

    public static KnowledgeBaseCodec codec() {
        return new KnowledgeBaseCodec(new ObjectMapper());
    }

    public static KnowledgeStore store(Path dir, String json) throws IOException {
        Path file = dir.resolve("problems.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return KnowledgeStore.load(file, codec());
    }
}

package com.example.techsewa.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BraveSearchBackendTest {

    private static BraveSearchBackend backend(String key) {
        return new BraveSearchBackend(WebClient.create(), new ObjectMapper(), key,
                BraveSearchBackend.DEFAULT_BASE_URL, 3);
    }

    @Test
    void parseStripsHighlightMarkupAndSkipsEmptyEntries() {
        List<SearchSnippet> results = backend("k").parse(Fixtures.read("brave-results.json"));

        assertThat(results).extracting(SearchSnippet::title)
                .containsExactly("How to clear a paper jam", "Printer jam FAQ");
        assertThat(results.get(0).excerpt()).isEqualTo("Turn off the printer and remove the stuck paper.");
        assertThat(results.get(0).link()).isEqualTo("https://printers.example.com/jam");
    }

    @Test
    void malformedPayloadIsAnError() {
        assertThatThrownBy(() -> backend("k").parse("{\"web\": {}}"))
                .isInstanceOf(WebSearchException.class);
        assertThatThrownBy(() -> backend("k").parse("<html>"))
                .isInstanceOf(WebSearchException.class);
    }

    @Test
    void missingKeyFailsFastWithoutCalling() {
        BraveSearchBackend brave = backend(" ");

        assertThat(brave.isConfigured()).isFalse();
        assertThatThrownBy(() -> brave.search("printer jam", "en", Duration.ofSeconds(1)))
                .isInstanceOf(WebSearchException.class)
                .hasMessageContaining("API key");
    }
}

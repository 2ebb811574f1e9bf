package com.example.techsewa.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Last resort of the cascade: asks each backend in order and returns the first usable
 * result set, joined into one answer.  Never throws; when every backend fails the
 * {@link #NO_RESULTS} sentinel is returned.
 */
public class WebFallback {
    private static final Logger log = LoggerFactory.getLogger(WebFallback.class);

    public static final String NO_RESULTS = "🔍 No relevant results online.";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(8);
    public static final int DEFAULT_MAX_RESULTS = 3;

    private final List<WebSearchBackend> backends;
    private final Duration timeout;
    private final int maxResults;

    public WebFallback(List<WebSearchBackend> backends) {
        this(backends, DEFAULT_TIMEOUT, DEFAULT_MAX_RESULTS);
    }

    public WebFallback(List<WebSearchBackend> backends, Duration timeout, int maxResults) {
        this.backends = List.copyOf(backends);
        this.timeout = timeout;
        this.maxResults = maxResults;
    }

    public String search(String query, String lang) {
        for (WebSearchBackend backend : backends) {
            try {
                List<SearchSnippet> results = backend.search(query, lang, timeout);
                if (results == null || results.isEmpty()) {
                    log.debug("[WEB] {} returned nothing for '{}'", backend.name(), query);
                    continue;
                }
                log.info("[WEB] {} answered '{}' with {} result(s)", backend.name(), query, results.size());
                return results.stream()
                        .limit(maxResults)
                        .map(SearchSnippet::format)
                        .collect(Collectors.joining("\n\n"));
            } catch (RuntimeException e) {
                log.warn("[WEB] {} failed: {}", backend.name(), e.getMessage());
            }
        }
        log.info("[WEB] all {} backend(s) exhausted for '{}'", backends.size(), query);
        return NO_RESULTS;
    }

    public List<String> backendNames() {
        return backends.stream().map(WebSearchBackend::name).toList();
    }
}

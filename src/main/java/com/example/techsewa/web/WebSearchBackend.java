package com.example.techsewa.web;

import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.util.List;

/**
 * One external search service.
 */
public interface WebSearchBackend {

    String name();

    String endpoint();

    HttpMethod method();

    /**
     * Run one request bounded by {@code timeout}.
     *
     * @return the parsed results, in rank order, never empty
     * @throws WebSearchException on network errors, malformed payloads, timeouts or empty results
     */
    List<SearchSnippet> search(String query, String lang, Duration timeout);
}

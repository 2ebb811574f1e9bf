package com.example.techsewa.web;

import com.example.techsewa.lang.Languages;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Brave Search API.  Header: {@code X-Subscription-Token: {API_KEY}}.
 * Without a key every call fails fast so the chain moves on.
 */
public class BraveSearchBackend implements WebSearchBackend {

    public static final String DEFAULT_BASE_URL = "https://api.search.brave.com";
    private static final String PATH = "/res/v1/web/search";

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String baseUrl;
    private final int maxResults;

    public BraveSearchBackend(WebClient webClient, ObjectMapper mapper, String apiKey, String baseUrl, int maxResults) {
        this.webClient = webClient;
        this.mapper = mapper;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.maxResults = maxResults;
    }

    @Override
    public String name() {
        return "brave";
    }

    @Override
    public String endpoint() {
        return baseUrl + PATH;
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.GET;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public List<SearchSnippet> search(String query, String lang, Duration timeout) {
        if (!isConfigured()) {
            throw new WebSearchException(name() + " has no API key");
        }
        String url = endpoint() + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&count=" + Math.max(1, maxResults);
        String body;
        try {
            body = webClient.get()
                    .uri(url)
                    .header("X-Subscription-Token", apiKey)
                    .header(HttpHeaders.ACCEPT_LANGUAGE, Languages.acceptLanguage(lang))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw WebSearchErrors.translate(name(), timeout, e);
        }
        if (body == null || body.isBlank()) {
            throw new WebSearchException(name() + " returned an empty body");
        }
        List<SearchSnippet> results = parse(body);
        if (results.isEmpty()) {
            throw new WebSearchException(name() + " returned no results");
        }
        return results;
    }

    /** web.results[].{title, description, url} */
    List<SearchSnippet> parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new WebSearchException(name() + " returned malformed JSON", e);
        }
        JsonNode results = root.path("web").path("results");
        if (!results.isArray()) {
            throw new WebSearchException(name() + " response has no web.results array");
        }
        List<SearchSnippet> out = new ArrayList<>();
        for (JsonNode n : results) {
            if (out.size() >= maxResults) {
                break;
            }
            String title = n.path("title").asText("").strip();
            String url = n.path("url").asText("").strip();
            if (title.isEmpty() && url.isEmpty()) {
                continue;
            }
            // descriptions carry <strong> highlight markup
            String desc = Jsoup.parse(n.path("description").asText("")).text().strip();
            out.add(new SearchSnippet(title, desc, url));
        }
        return out;
    }
}

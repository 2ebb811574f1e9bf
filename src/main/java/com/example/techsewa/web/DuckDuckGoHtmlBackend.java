package com.example.techsewa.web;

import com.example.techsewa.lang.Languages;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scrapes the DuckDuckGo HTML endpoint; needs no API key.
 */
public class DuckDuckGoHtmlBackend implements WebSearchBackend {

    public static final String DEFAULT_ENDPOINT = "https://html.duckduckgo.com/html/";
    private static final String USER_AGENT = "Mozilla/5.0";

    private final WebClient webClient;
    private final String endpoint;
    private final int maxResults;

    public DuckDuckGoHtmlBackend(WebClient webClient, String endpoint, int maxResults) {
        this.webClient = webClient;
        this.endpoint = endpoint;
        this.maxResults = maxResults;
    }

    @Override
    public String name() {
        return "duckduckgo";
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.POST;
    }

    @Override
    public List<SearchSnippet> search(String query, String lang, Duration timeout) {
        String html;
        try {
            html = webClient.post()
                    .uri(endpoint)
                    .header(HttpHeaders.USER_AGENT, USER_AGENT)
                    .header(HttpHeaders.ACCEPT_LANGUAGE, Languages.acceptLanguage(lang))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData("q", query))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw WebSearchErrors.translate(name(), timeout, e);
        }
        if (html == null || html.isBlank()) {
            throw new WebSearchException(name() + " returned an empty page");
        }
        List<SearchSnippet> results = parse(html, maxResults);
        if (results.isEmpty()) {
            throw new WebSearchException(name() + " returned no results");
        }
        return results;
    }

    static List<SearchSnippet> parse(String html, int max) {
        Document doc = Jsoup.parse(html);
        List<SearchSnippet> out = new ArrayList<>();
        for (Element body : doc.select(".result__body")) {
            if (out.size() >= max) {
                break;
            }
            Element a = body.selectFirst(".result__a");
            if (a == null) {
                continue;
            }
            Element snippet = body.selectFirst(".result__snippet");
            out.add(new SearchSnippet(
                    a.text().strip(),
                    snippet == null ? "" : snippet.text().strip(),
                    cleanLink(a.attr("href"))));
        }
        return out;
    }

    /** DuckDuckGo wraps targets as {@code //duckduckgo.com/l/?uddg=<encoded>&...}. */
    static String cleanLink(String href) {
        int i = href.indexOf("uddg=");
        if (i < 0) {
            return href;
        }
        String enc = href.substring(i + 5);
        int amp = enc.indexOf('&');
        if (amp >= 0) {
            enc = enc.substring(0, amp);
        }
        try {
            return URLDecoder.decode(enc, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return href;
        }
    }
}

package com.example.techsewa.web;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DuckDuckGoHtmlBackendTest {

    private static WebClient answering(String body, AtomicReference<ClientRequest> seen) {
        return WebClient.builder()
                .exchangeFunction(req -> {
                    seen.set(req);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
                            .body(body)
                            .build());
                })
                .build();
    }

    @Test
    void parseReadsTitleSnippetAndLink() {
        List<SearchSnippet> results = DuckDuckGoHtmlBackend.parse(Fixtures.read("duckduckgo-results.html"), 3);

        assertThat(results).hasSize(3);
        assertThat(results.get(0)).isEqualTo(new SearchSnippet(
                "Fix Wi-Fi connection problems",
                "Restart your router and modem, then reconnect.",
                "https://support.example.com/wifi?a=1"));
        assertThat(results.get(1).excerpt()).isEmpty();
        assertThat(results.get(2).title()).isEqualTo("Third result");
    }

    @Test
    void cleanLinkUnwrapsRedirect() {
        assertThat(DuckDuckGoHtmlBackend.cleanLink("//duckduckgo.com/l/?uddg=https%3A%2F%2Fa.example%2Fx&rut=1"))
                .isEqualTo("https://a.example/x");
        assertThat(DuckDuckGoHtmlBackend.cleanLink("https://plain.example/")).isEqualTo("https://plain.example/");
    }

    @Test
    void searchPostsFormAndParsesPage() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        DuckDuckGoHtmlBackend backend = new DuckDuckGoHtmlBackend(
                answering(Fixtures.read("duckduckgo-results.html"), seen), DuckDuckGoHtmlBackend.DEFAULT_ENDPOINT, 2);

        List<SearchSnippet> results = backend.search("wifi not working", "np", Duration.ofSeconds(2));

        assertThat(results).hasSize(2);
        assertThat(seen.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(seen.get().url().toString()).isEqualTo(DuckDuckGoHtmlBackend.DEFAULT_ENDPOINT);
        assertThat(seen.get().headers().getFirst(HttpHeaders.ACCEPT_LANGUAGE)).isEqualTo("ne");
    }

    @Test
    void pageWithoutResultsIsAnError() {
        DuckDuckGoHtmlBackend backend = new DuckDuckGoHtmlBackend(
                answering("<html><body>No results.</body></html>", new AtomicReference<>()),
                DuckDuckGoHtmlBackend.DEFAULT_ENDPOINT, 3);

        assertThatThrownBy(() -> backend.search("zzzz", "en", Duration.ofSeconds(2)))
                .isInstanceOf(WebSearchException.class)
                .hasMessageContaining("no results");
    }

    @Test
    void slowBackendTimesOut() {
        WebClient hanging = WebClient.builder().exchangeFunction(req -> Mono.never()).build();
        DuckDuckGoHtmlBackend backend = new DuckDuckGoHtmlBackend(hanging, DuckDuckGoHtmlBackend.DEFAULT_ENDPOINT, 3);

        assertThatThrownBy(() -> backend.search("wifi", "en", Duration.ofMillis(100)))
                .isInstanceOf(WebSearchTimeoutException.class);
    }
}

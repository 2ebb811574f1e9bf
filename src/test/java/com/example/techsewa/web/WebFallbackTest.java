package com.example.techsewa.web;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class WebFallbackTest {

    /** Stub backend answering from a fixed script. */
    private static WebSearchBackend backend(String name, RuntimeException failure, SearchSnippet... results) {
        return new WebSearchBackend() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String endpoint() {
                return "stub://" + name;
            }

            @Override
            public HttpMethod method() {
                return HttpMethod.GET;
            }

            @Override
            public List<SearchSnippet> search(String query, String lang, Duration timeout) {
                if (failure != null) {
                    throw failure;
                }
                return List.of(results);
            }
        };
    }

    private static SearchSnippet snippet(int i) {
        return new SearchSnippet("title " + i, "excerpt " + i, "https://r" + i + ".example/");
    }

    @Test
    void everyBackendFailingGivesSentinel() {
        WebFallback web = new WebFallback(List.of(
                backend("a", new WebSearchTimeoutException("a", Duration.ofSeconds(8), null)),
                backend("b", new IllegalStateException("parser exploded"))));

        assertThat(web.search("wifi", "en")).isEqualTo(WebFallback.NO_RESULTS);
    }

    @Test
    void noBackendsGivesSentinel() {
        assertThat(new WebFallback(List.of()).search("wifi", "en")).isEqualTo(WebFallback.NO_RESULTS);
    }

    @Test
    void fallsThroughToNextBackend() {
        AtomicInteger thirdCalls = new AtomicInteger();
        WebSearchBackend third = new WebSearchBackend() {
            @Override
            public String name() {
                return "c";
            }

            @Override
            public String endpoint() {
                return "stub://c";
            }

            @Override
            public HttpMethod method() {
                return HttpMethod.GET;
            }

            @Override
            public List<SearchSnippet> search(String query, String lang, Duration timeout) {
                thirdCalls.incrementAndGet();
                return List.of(snippet(9));
            }
        };
        WebFallback web = new WebFallback(List.of(
                backend("a", new WebSearchException("down")),
                backend("b", null, snippet(1)),
                third));

        assertThat(web.search("wifi", "en")).isEqualTo(snippet(1).format());
        assertThat(thirdCalls).hasValue(0);
        assertThat(web.backendNames()).containsExactly("a", "b", "c");
    }

    @Test
    void joinsAtMostMaxResults() {
        WebFallback web = new WebFallback(
                List.of(backend("a", null, snippet(1), snippet(2), snippet(3), snippet(4))),
                Duration.ofSeconds(1), 3);

        String answer = web.search("wifi", "en");

        assertThat(answer.split("\n\n")).hasSize(3);
        assertThat(answer).startsWith("🔎 title 1\n📝 excerpt 1\n🔗 https://r1.example/");
        assertThat(answer).doesNotContain("title 4");
    }
}

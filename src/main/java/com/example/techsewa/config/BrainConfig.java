package com.example.techsewa.config;

import com.example.techsewa.brain.QueryHistory;
import com.example.techsewa.brain.ResolutionOrchestrator;
import com.example.techsewa.knowledge.KnowledgeStore;
import com.example.techsewa.lang.LanguageDetector;
import com.example.techsewa.match.MatchEngine;
import com.example.techsewa.semantic.NoopSemanticMatcher;
import com.example.techsewa.semantic.SemanticMatcher;
import com.example.techsewa.semantic.SemanticMatchers;
import com.example.techsewa.web.BraveSearchBackend;
import com.example.techsewa.web.DuckDuckGoHtmlBackend;
import com.example.techsewa.web.WebFallback;
import com.example.techsewa.web.WebSearchBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Configuration
public class BrainConfig {
    private static final Logger log = LoggerFactory.getLogger(BrainConfig.class);

    // Allow both `search.brave.*` and the BRAVE_API_KEY environment variable.
    @Value("${search.brave.api-key:${BRAVE_API_KEY:}}")
    private String braveApiKey;

    @Value("${search.brave.base-url:" + BraveSearchBackend.DEFAULT_BASE_URL + "}")
    private String braveBaseUrl;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public MatchEngine matchEngine(KnowledgeStore store, TechsewaProperties props) {
        return new MatchEngine(store, props.getMatch().getMinConfidence(), props.getMatch().getCacheSize());
    }

    @Bean
    public SemanticMatcher semanticMatcher(KnowledgeStore store, TechsewaProperties props) {
        if (!props.getSemantic().isEnabled()) {
            return NoopSemanticMatcher.INSTANCE;
        }
        return SemanticMatchers.create(AllMiniLmL6V2EmbeddingModel::new, store);
    }

    /* ---------- outbound search ---------- */
    @Bean(name = "searchWebClient")
    public WebClient searchWebClient(WebClient.Builder builder, TechsewaProperties props) {
        int timeoutMs = (int) props.getWeb().getTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
                .compress(true)
                .followRedirect(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs)
                .responseTimeout(props.getWeb().getTimeout());
        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
    }

    @Bean
    public WebFallback webFallback(WebClient searchWebClient, ObjectMapper objectMapper, TechsewaProperties props) {
        TechsewaProperties.Web web = props.getWeb();
        List<WebSearchBackend> backends = new ArrayList<>();
        for (String name : web.getBackends()) {
            switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "duckduckgo" -> backends.add(
                        new DuckDuckGoHtmlBackend(searchWebClient, web.getDuckduckgoEndpoint(), web.getMaxResults()));
                case "brave" -> {
                    BraveSearchBackend brave = new BraveSearchBackend(
                            searchWebClient, objectMapper, braveApiKey, braveBaseUrl, web.getMaxResults());
                    if (brave.isConfigured()) {
                        backends.add(brave);
                    } else {
                        log.info("[WEB] brave backend skipped: search.brave.api-key is empty");
                    }
                }
                default -> log.warn("[WEB] unknown search backend '{}' ignored", name);
            }
        }
        return new WebFallback(backends, web.getTimeout(), web.getMaxResults());
    }

    @Bean
    public ResolutionOrchestrator resolutionOrchestrator(KnowledgeStore store,
                                                         MatchEngine matchEngine,
                                                         SemanticMatcher semanticMatcher,
                                                         WebFallback webFallback,
                                                         TechsewaProperties props,
                                                         Clock clock) {
        return new ResolutionOrchestrator(
                store,
                matchEngine,
                semanticMatcher,
                props.getWeb().isEnabled() ? webFallback : null,
                new QueryHistory(props.getHistory().getCapacity()),
                new LanguageDetector(),
                clock,
                props.getSemantic().getThreshold());
    }
}

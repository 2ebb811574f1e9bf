package com.example.techsewa.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code techsewa.*}.  Every field has a working default so the
 * service starts with an empty configuration.
 */
@ConfigurationProperties(prefix = "techsewa")
public class TechsewaProperties {

    private Knowledge knowledge = new Knowledge();
    private Match match = new Match();
    private Semantic semantic = new Semantic();
    private Web web = new Web();
    private History history = new History();
    private Monitor monitor = new Monitor();
    private Healer healer = new Healer();
    private Diagnostics diagnostics = new Diagnostics();

    public Knowledge getKnowledge() {
        return knowledge;
    }

    public void setKnowledge(Knowledge knowledge) {
        this.knowledge = knowledge;
    }

    public Match getMatch() {
        return match;
    }

    public void setMatch(Match match) {
        this.match = match;
    }

    public Semantic getSemantic() {
        return semantic;
    }

    public void setSemantic(Semantic semantic) {
        this.semantic = semantic;
    }

    public Web getWeb() {
        return web;
    }

    public void setWeb(Web web) {
        this.web = web;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public void setMonitor(Monitor monitor) {
        this.monitor = monitor;
    }

    public Healer getHealer() {
        return healer;
    }

    public void setHealer(Healer healer) {
        this.healer = healer;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public void setDiagnostics(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    @Getter
    @Setter
    public static class Knowledge {
        /** Persisted knowledge-base file. */
        private String path = "./data/problems.json";
        /** Copy the bundled seed into {@link #path} when the file does not exist. */
        private boolean bootstrapIfMissing = true;
    }

    @Getter
    @Setter
    public static class Match {
        private int minConfidence = 75;
        private int cacheSize = 500;
    }

    @Getter
    @Setter
    public static class Semantic {
        private boolean enabled = false;
        private double threshold = 0.60;
    }

    @Getter
    @Setter
    public static class Web {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(8);
        private int maxResults = 3;
        /** Backend names in the order they are tried. */
        private List<String> backends = new ArrayList<>(List.of("duckduckgo", "brave"));
        private String duckduckgoEndpoint = "https://html.duckduckgo.com/html/";
    }

    @Getter
    @Setter
    public static class History {
        private int capacity = 20;
    }

    @Getter
    @Setter
    public static class Monitor {
        private boolean enabled = false;
        private Duration interval = Duration.ofSeconds(10);
        private boolean autoHeal = true;
        private double cpuPercent = 90;
        private double memoryPercent = 90;
        private double storagePercent = 90;
        private double minUploadKbps = 10;
        private double minDownloadKbps = 10;
        private double lowBatteryPercent = 20;
    }

    @Getter
    @Setter
    public static class Healer {
        private boolean allowProcessTermination = false;
        private Duration commandTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Diagnostics {
        private String connectivityHost = "8.8.8.8";
        private int connectivityPort = 53;
        private Duration connectivityTimeout = Duration.ofSeconds(3);
    }
}

package com.example.techsewa.api;

import com.example.techsewa.brain.BrainStats;
import com.example.techsewa.brain.QueryHistoryEntry;
import com.example.techsewa.brain.ResolutionOrchestrator;
import com.example.techsewa.brain.SolveResult;
import com.example.techsewa.diagnostics.DiagnosticsService;
import com.example.techsewa.diagnostics.SystemInfo;
import com.example.techsewa.health.AutoHealer;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Front-end boundary.  Delegates only; no rendering.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HelpDeskController {

    private final ResolutionOrchestrator brain;
    private final DiagnosticsService diagnostics;
    private final AutoHealer autoHealer;

    @PostMapping("/solve")
    public SolveResult solve(@RequestBody SolveRequest req) {
        return brain.solve(req.query(), req.lang(), req.minConfidence());
    }

    @PostMapping("/teach")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void teach(@RequestBody TeachRequest req) {
        brain.teach(req.query(), req.answerEn(), req.answerNp());
    }

    @GetMapping("/stats")
    public BrainStats stats() {
        return brain.stats();
    }

    @GetMapping("/history")
    public List<QueryHistoryEntry> history() {
        return brain.history();
    }

    @GetMapping("/diagnostics")
    public List<String> diagnostics() {
        return diagnostics.runAll();
    }

    @GetMapping("/system")
    public SystemInfo system() {
        return diagnostics.systemInfo();
    }

    @PostMapping("/heal/{code}")
    public HealResponse heal(@PathVariable("code") int code) {
        return new HealResponse(code, autoHealer.heal(code));
    }

    public record SolveRequest(String query, String lang, Integer minConfidence) {
    }

    public record TeachRequest(String query, String answerEn, String answerNp) {
    }

    public record HealResponse(int code, boolean healed) {
    }
}

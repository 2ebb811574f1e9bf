package com.example.techsewa.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of remediation actions keyed by signal kind.  {@link #heal} runs the action
 * synchronously and never throws.
 */
public class AutoHealer {
    private static final Logger log = LoggerFactory.getLogger(AutoHealer.class);

    private final Map<SignalKind, RemediationAction> actions;

    public AutoHealer(Map<SignalKind, RemediationAction> actions) {
        this.actions = actions.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(actions));
    }

    /**
     * @return {@code false} for unknown codes, kinds without an action, and failed attempts
     */
    public boolean heal(int code) {
        Optional<SignalKind> kind = SignalKind.fromCode(code);
        if (kind.isEmpty()) {
            log.warn("[HEAL] unknown signal code {}", code);
            return false;
        }
        return heal(kind.get());
    }

    public boolean heal(SignalKind kind) {
        RemediationAction action = actions.get(kind);
        if (action == null) {
            log.info("[HEAL] no action registered for {}", kind);
            return false;
        }
        try {
            boolean ok = action.run();
            log.info("[HEAL] {} -> {}", kind, ok ? "fixed" : "not fixed");
            return ok;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[HEAL] {} interrupted", kind);
            return false;
        } catch (Exception e) {
            log.warn("[HEAL] {} failed: {}", kind, e.toString());
            return false;
        }
    }

    public Set<SignalKind> supportedKinds() {
        return actions.keySet();
    }
}

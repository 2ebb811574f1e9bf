package com.example.techsewa.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production alert sink: logs every alert and, when enabled, asks the healer for a fix.
 */
public class HealthAlertHandler implements HealthAlertListener {
    private static final Logger log = LoggerFactory.getLogger(HealthAlertHandler.class);

    private final AutoHealer healer;
    private final boolean autoHeal;

    public HealthAlertHandler(AutoHealer healer, boolean autoHeal) {
        this.healer = healer;
        this.autoHeal = autoHeal;
    }

    @Override
    public void onAlert(String message, int code) {
        log.warn("[MONITOR] system alert ({}): {}", code, message);
        if (!autoHeal) {
            return;
        }
        if (healer.heal(code)) {
            log.info("[MONITOR] auto-healer attempted a fix for {}", code);
        }
    }
}

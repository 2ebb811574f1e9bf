package com.example.techsewa.health;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class HealthAlertHandlerTest {

    @Test
    void healsOnlyWhenEnabled() {
        AtomicInteger runs = new AtomicInteger();
        AutoHealer healer = new AutoHealer(Map.of(SignalKind.CPU, () -> runs.incrementAndGet() > 0));

        new HealthAlertHandler(healer, false).onAlert("High CPU usage: 95.0%", 103);
        assertThat(runs).hasValue(0);

        new HealthAlertHandler(healer, true).onAlert("High CPU usage: 95.0%", 103);
        new HealthAlertHandler(healer, true).onAlert("unknown", 999);
        assertThat(runs).hasValue(1);
    }
}

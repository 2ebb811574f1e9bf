package com.example.techsewa.health;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class AutoHealerTest {

    @Test
    void runsRegisteredAction() {
        AutoHealer healer = new AutoHealer(Map.of(SignalKind.NETWORK, () -> true));

        assertThat(healer.heal(101)).isTrue();
        assertThat(healer.supportedKinds()).containsExactly(SignalKind.NETWORK);
    }

    @Test
    void unknownCodeOrKindIsFalse() {
        AutoHealer healer = new AutoHealer(Map.of(SignalKind.NETWORK, () -> true));

        assertThat(healer.heal(999)).isFalse();
        assertThat(healer.heal(SignalKind.CPU)).isFalse();
        assertThat(new AutoHealer(Map.of()).heal(101)).isFalse();
    }

    @Test
    void failuresBecomeFalse() {
        Map<SignalKind, RemediationAction> actions = new EnumMap<>(SignalKind.class);
        actions.put(SignalKind.CPU, () -> {
            throw new IllegalStateException("no permission");
        });
        actions.put(SignalKind.MEMORY, () -> {
            throw new java.io.IOException("sync missing");
        });
        actions.put(SignalKind.STORAGE, () -> false);
        AutoHealer healer = new AutoHealer(actions);

        assertThat(healer.heal(SignalKind.CPU)).isFalse();
        assertThat(healer.heal(SignalKind.MEMORY)).isFalse();
        assertThat(healer.heal(SignalKind.STORAGE)).isFalse();
    }

    @Test
    void interruptIsPreserved() {
        AutoHealer healer = new AutoHealer(Map.of(SignalKind.NETWORK, () -> {
            throw new InterruptedException();
        }));

        assertThat(healer.heal(SignalKind.NETWORK)).isFalse();
        assertThat(Thread.interrupted()).isTrue();
    }
}

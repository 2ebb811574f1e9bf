package com.example.techsewa.health;

import java.util.Optional;

/**
 * Kinds of health problem, each with the numeric code passed to alert callbacks.
 */
public enum SignalKind {
    NETWORK(101),
    POWER(102),
    CPU(103),
    MEMORY(104),
    STORAGE(105);

    private final int code;

    SignalKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<SignalKind> fromCode(int code) {
        for (SignalKind k : values()) {
            if (k.code == code) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}

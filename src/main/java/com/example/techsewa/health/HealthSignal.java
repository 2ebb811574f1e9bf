package com.example.techsewa.health;

public record HealthSignal(SignalKind kind, String message, int severityCode) {

    public static HealthSignal of(SignalKind kind, String message) {
        return new HealthSignal(kind, message, kind.code());
    }
}

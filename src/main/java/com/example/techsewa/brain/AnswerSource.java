package com.example.techsewa.brain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnswerSource {
    LOCAL,
    SEMANTIC,
    INTERNET,
    NONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.example.techsewa.semantic;

public record SemanticHit(String answer, String recordId, double similarity) {
}

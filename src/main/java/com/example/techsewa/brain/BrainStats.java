package com.example.techsewa.brain;

public record BrainStats(int totalProblems, int cacheSize, boolean semanticEnabled, boolean internetEnabled) {
}

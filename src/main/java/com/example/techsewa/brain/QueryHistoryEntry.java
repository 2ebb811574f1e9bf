package com.example.techsewa.brain;

import java.time.Instant;

public record QueryHistoryEntry(Instant timestamp, String query, String lang) {
}

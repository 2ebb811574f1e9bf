package com.example.techsewa.brain;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Most recent queries, oldest dropped first.  Diagnostics only; never persisted.
 */
public class QueryHistory {

    public static final int DEFAULT_CAPACITY = 20;

    private final int capacity;
    private final Deque<QueryHistoryEntry> entries;

    public QueryHistory() {
        this(DEFAULT_CAPACITY);
    }

    public QueryHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public synchronized void record(QueryHistoryEntry entry) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    /** Oldest first. */
    public synchronized List<QueryHistoryEntry> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}

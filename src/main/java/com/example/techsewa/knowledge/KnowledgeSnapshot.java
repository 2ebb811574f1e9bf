package com.example.techsewa.knowledge;

import java.util.ArrayList;
import java.util.List;

/**
 * Consistent view of the store: the record list and the index built from it.
 * A new snapshot replaces the old one wholesale on every mutation.
 *
 * @param generation increases by one per mutation, starting at 0 after load
 */
public record KnowledgeSnapshot(long generation, List<ProblemRecord> records, AliasIndex index) {

    public static KnowledgeSnapshot of(long generation, List<ProblemRecord> records) {
        List<ProblemRecord> copy = List.copyOf(records);
        return new KnowledgeSnapshot(generation, copy, AliasIndex.build(copy));
    }

    public KnowledgeSnapshot append(ProblemRecord record) {
        List<ProblemRecord> next = new ArrayList<>(records.size() + 1);
        next.addAll(records);
        next.add(record);
        return of(generation + 1, next);
    }

    public boolean containsId(String id) {
        return records.stream().anyMatch(r -> r.getId().equals(id));
    }
}

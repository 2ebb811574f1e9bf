package com.example.techsewa.knowledge;

/**
 * Notified after a new snapshot has been published and before the writer lock is released.
 */
@FunctionalInterface
public interface KnowledgeListener {

    void onAppend(KnowledgeSnapshot snapshot, ProblemRecord appended);
}

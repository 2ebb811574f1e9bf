package com.example.techsewa.knowledge;

import com.example.techsewa.common.TechsewaException;

/**
 * Raised when an accepted record could not be written to storage.  The record
 * stays in memory; the caller decides whether to retry the write.
 */
public class KnowledgePersistenceException extends TechsewaException {

    private final transient ProblemRecord record;

    public KnowledgePersistenceException(ProblemRecord record, Throwable cause) {
        super("Failed to persist knowledge record " + record.getId(), cause);
        this.record = record;
    }

    public ProblemRecord getRecord() {
        return record;
    }
}

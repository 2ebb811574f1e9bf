package com.example.techsewa.knowledge;

import com.example.techsewa.common.TechsewaException;

/**
 * Raised when the persisted payload is not a JSON array of records.
 * A single malformed record inside a valid array is skipped, not reported here.
 */
public class KnowledgeBaseFormatException extends TechsewaException {

    public KnowledgeBaseFormatException(String message) {
        super(message);
    }

    public KnowledgeBaseFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

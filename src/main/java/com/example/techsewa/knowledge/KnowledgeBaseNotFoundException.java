package com.example.techsewa.knowledge;

import com.example.techsewa.common.TechsewaException;

import java.nio.file.Path;

/**
 * Raised when the knowledge-base source does not exist.
 */
public class KnowledgeBaseNotFoundException extends TechsewaException {

    private final Path source;

    public KnowledgeBaseNotFoundException(Path source) {
        super("Problem DB not found: " + source);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}

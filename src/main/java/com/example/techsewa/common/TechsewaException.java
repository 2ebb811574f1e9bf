package com.example.techsewa.common;

/**
 * Root of the engine's unchecked exception hierarchy.
 */
public class TechsewaException extends RuntimeException {

    public TechsewaException(String message) {
        super(message);
    }

    public TechsewaException(String message, Throwable cause) {
        super(message, cause);
    }
}

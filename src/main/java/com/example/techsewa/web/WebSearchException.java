package com.example.techsewa.web;

import com.example.techsewa.common.TechsewaException;

/**
 * A single backend could not produce results.  Never escapes {@link WebFallback}.
 */
public class WebSearchException extends TechsewaException {

    public WebSearchException(String message) {
        super(message);
    }

    public WebSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}

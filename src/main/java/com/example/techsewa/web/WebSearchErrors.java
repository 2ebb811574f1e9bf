package com.example.techsewa.web;

import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures escaping a blocking WebClient call onto the search exception types.
 */
final class WebSearchErrors {

    private WebSearchErrors() {}

    static WebSearchException translate(String backend, Duration timeout, RuntimeException e) {
        if (e instanceof WebSearchException wse) {
            return wse;
        }
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof TimeoutException) {
            return new WebSearchTimeoutException(backend, timeout, cause);
        }
        return new WebSearchException(backend + " request failed: " + cause.getMessage(), cause);
    }
}

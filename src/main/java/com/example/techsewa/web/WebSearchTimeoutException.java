package com.example.techsewa.web;

import java.time.Duration;

public class WebSearchTimeoutException extends WebSearchException {

    public WebSearchTimeoutException(String backend, Duration timeout, Throwable cause) {
        super(backend + " did not answer within " + timeout.toMillis() + "ms", cause);
    }
}

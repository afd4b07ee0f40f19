package com.handelsregister.scraper.exception;

import java.time.Duration;

/**
 * The search pipeline did not finish within the configured bound. The
 * underlying portal exchange may still be running.
 */
public class SearchTimeoutException extends RuntimeException {

    public SearchTimeoutException(final Duration limit, final Throwable cause) {
        super("Request exceeded timeout of " + limit.toSeconds() + " seconds", cause);
    }
}

package com.handelsregister.scraper.exception;

import lombok.Getter;

/**
 * The caller used up its request allowance for the current window.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final String caller;

    public RateLimitExceededException(final String caller, final String limit) {
        super(limit);
        this.caller = caller;
    }
}

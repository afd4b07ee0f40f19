package com.handelsregister.scraper.exception;

import lombok.Getter;

import java.util.List;

/**
 * Missing or invalid request input. Carries the acceptable values where
 * there is a closed set of them.
 */
@Getter
public class RequestValidationException extends RuntimeException {

    private final List<String> options;

    public RequestValidationException(final String message) {
        this(message, List.of());
    }

    public RequestValidationException(final String message, final List<String> options) {
        super(message);
        this.options = List.copyOf(options);
    }
}

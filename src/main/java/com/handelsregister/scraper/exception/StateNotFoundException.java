package com.handelsregister.scraper.exception;

import lombok.Getter;

/**
 * A state name or code that the registry does not know.
 */
@Getter
public class StateNotFoundException extends RuntimeException {

    private final String input;

    public StateNotFoundException(final String input) {
        super("Unknown district name: " + input);
        this.input = input;
    }
}

package com.handelsregister.scraper.exception;

/**
 * Missing, malformed or unverifiable service token.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(final String reason) {
        super(reason);
    }
}

package com.handelsregister.scraper.exception;

/**
 * Base class for failures talking to the register portal.
 */
public abstract class PortalException extends RuntimeException {

    protected PortalException(final String message) {
        super(message);
    }

    protected PortalException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

package com.handelsregister.scraper.exception;

/**
 * Network-level failure: unreachable host, timeout, non-2xx status, redirect loop.
 */
public class PortalTransportException extends PortalException {

    public PortalTransportException(final String message) {
        super(message);
    }

    public PortalTransportException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

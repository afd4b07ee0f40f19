package com.handelsregister.scraper.exception;

/**
 * The portal start page could not be loaded, so no search can run.
 */
public class PortalConnectException extends PortalException {

    public PortalConnectException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

package com.handelsregister.scraper.exception;

/**
 * A form or control the search protocol depends on is missing, which means
 * the portal changed its page layout.
 */
public class PortalStructureException extends PortalException {

    public PortalStructureException(final String message) {
        super(message);
    }
}

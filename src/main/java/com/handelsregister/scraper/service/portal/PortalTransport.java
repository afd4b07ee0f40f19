package com.handelsregister.scraper.service.portal;

import com.handelsregister.scraper.exception.PortalTransportException;

import java.net.URI;

/**
 * Browser-like HTTP capability used by a {@link RegistryPortalSession}.
 * Implementations keep cookies between calls and follow redirects; one
 * instance belongs to exactly one session.
 */
public interface PortalTransport {

    /**
     * GET a page.
     *
     * @throws PortalTransportException on network failure or non-2xx status
     */
    PortalPage fetch(URI uri);

    /**
     * Submit a form.
     *
     * @throws PortalTransportException on network failure or non-2xx status
     */
    PortalPage submit(FormSubmission submission);
}

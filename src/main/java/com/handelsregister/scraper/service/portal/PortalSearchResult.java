package com.handelsregister.scraper.service.portal;

import java.util.List;

/**
 * Raw result page of a portal search plus the optional form fields that
 * could not be applied.
 */
public record PortalSearchResult(String html, List<String> warnings) {

    public PortalSearchResult {
        warnings = List.copyOf(warnings);
    }
}

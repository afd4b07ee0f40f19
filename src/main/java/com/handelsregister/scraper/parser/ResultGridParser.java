package com.handelsregister.scraper.parser;

import com.handelsregister.scraper.model.Company;

import java.util.List;

/**
 * Converts the portal's search result page into company records.
 */
@FunctionalInterface
public interface ResultGridParser {

    /**
     * @param html complete result page as returned by the portal (or the cache)
     * @return companies in grid order; may be empty but never {@code null}
     */
    List<Company> parse(String html);

}

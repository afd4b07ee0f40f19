package com.handelsregister.scraper.service.core;

import com.handelsregister.scraper.model.Company;
import com.handelsregister.scraper.model.SearchQuery;

import java.util.List;

/**
 * Defines a contract for searching the common register by keywords.
 */
public interface CompanySearchService {

    /**
     * Searches for companies matching {@code query}.
     *
     * @param query keywords, match mode, state filter and cache policy
     * @return a non-null, possibly empty list of companies in portal order
     * @throws com.handelsregister.scraper.exception.PortalException
     *     if the portal cannot be reached or its forms changed
     */
    List<Company> search(SearchQuery query);
}

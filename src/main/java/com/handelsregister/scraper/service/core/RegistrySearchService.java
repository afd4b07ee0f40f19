package com.handelsregister.scraper.service.core;

import com.handelsregister.scraper.cache.ResultCache;
import com.handelsregister.scraper.model.Company;
import com.handelsregister.scraper.model.SearchQuery;
import com.handelsregister.scraper.parser.ResultGridParser;
import com.handelsregister.scraper.service.portal.PortalSearchResult;
import com.handelsregister.scraper.service.portal.RegistryPortalSession;
import com.handelsregister.scraper.service.portal.RegistryPortalSessionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * <h2>Register search</h2>
 *
 * <p>Cache first, portal second:</p>
 * <ul>
 *   <li>Unless the query bypasses the cache, a document cached under the
 *       literal keyword string is parsed and returned without any network
 *       traffic.</li>
 *   <li>Otherwise a fresh portal session runs the search, the raw page is
 *       written to the cache (replacing an older entry) and then parsed.</li>
 * </ul>
 * <p>Portal failures propagate unchanged.</p>
 */
@Slf4j
@Service
public class RegistrySearchService implements CompanySearchService {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final RegistryPortalSessionFactory sessions;

    private final ResultCache cache;

    private final ResultGridParser parser;

    public RegistrySearchService(final RegistryPortalSessionFactory sessions,
                                 final ResultCache cache,
                                 @Qualifier("registerGridParser") final ResultGridParser parser) {
        this.sessions = sessions;
        this.cache = cache;
        this.parser = parser;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<Company> search(final SearchQuery query) {
        if (!query.bypassCache()) {
            Optional<String> cached = cache.get(query.keywords());
            if (cached.isPresent()) {
                log.info("Returning cached content for '{}'", query.keywords());
                return parser.parse(cached.get());
            }
        }

        long t0 = System.nanoTime();
        RegistryPortalSession session = sessions.newSession();
        session.open();
        PortalSearchResult result = session.submitSearch(query);
        long t1 = System.nanoTime();

        result.warnings().forEach(w -> log.debug("'{}': {}", query.keywords(), w));
        cache.put(query.keywords(), result.html());

        List<Company> companies = parser.parse(result.html());
        long t2 = System.nanoTime();
        log.info("Register search '{}' mode={} states={}: {} hits  NET={} ms  PARSE={} ms",
                query.keywords(), query.matchMode(), query.stateFilter(), companies.size(),
                (t1 - t0) / NANOS_PER_MILLI, (t2 - t1) / NANOS_PER_MILLI);
        return companies;
    }
}

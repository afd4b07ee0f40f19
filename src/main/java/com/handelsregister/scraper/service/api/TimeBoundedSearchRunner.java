package com.handelsregister.scraper.service.api;

import com.handelsregister.scraper.exception.SearchTimeoutException;
import com.handelsregister.scraper.model.Company;
import com.handelsregister.scraper.model.SearchQuery;
import com.handelsregister.scraper.service.core.CompanySearchService;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Runs a search on the portal executor under a wall-clock bound.
 *
 * <p>The {@link TimeLimiter} is configured not to cancel the running future.
 * On timeout the caller stops waiting and gets a {@link SearchTimeoutException};
 * the search itself is abandoned and may keep running (and keep its portal
 * connection) until the transport's own timeouts end it.</p>
 */
@Slf4j
@Component
public class TimeBoundedSearchRunner {

    private final CompanySearchService searchService;

    private final TimeLimiter timeLimiter;

    private final ExecutorService executor;

    public TimeBoundedSearchRunner(final CompanySearchService searchService,
                                   @Qualifier("searchTimeLimiter") final TimeLimiter timeLimiter,
                                   @Qualifier("portalSearchExecutor") final ExecutorService executor) {
        this.searchService = searchService;
        this.timeLimiter = timeLimiter;
        this.executor = executor;
    }

    public List<Company> run(final SearchQuery query) {
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> searchService.search(query), executor));
        } catch (TimeoutException ex) {
            Duration limit = timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
            log.warn("Search '{}' abandoned after {}", query.keywords(), limit);
            throw new SearchTimeoutException(limit, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for search", ex);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("Search failed: " + ex.getMessage(), ex);
        }
    }
}

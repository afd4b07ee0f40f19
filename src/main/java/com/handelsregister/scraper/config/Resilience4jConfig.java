package com.handelsregister.scraper.config;

import com.handelsregister.scraper.service.api.RateLimitSpec;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Request admission and pipeline bounding for the REST façade:
 * </p>
 * <ul>
 *   <li>a {@link RateLimiterRegistry} whose default config is the configured
 *       per-caller limit; one {@link RateLimiter} per caller is created on demand,</li>
 *   <li>a {@link TimeLimiter} for the search pipeline that abandons, but does
 *       not cancel, a search running past the request timeout,</li>
 *   <li>the executor those searches run on.</li>
 * </ul>
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    @Bean
    public RateLimitSpec rateLimitSpec(final ApiProperties props) {
        RateLimitSpec spec = RateLimitSpec.parse(props.getRateLimitDefault());
        log.info("Per-caller rate limit: {} requests per {}", spec.limit(), spec.window());
        return spec;
    }

    /**
     * Fixed-window limiter config: {@code limit} permits per {@code window},
     * callers over the limit are rejected immediately rather than queued.
     *
     * @param spec parsed rate limit
     * @return registry with that config as default
     */
    @Bean
    public RateLimiterRegistry rateLimiterRegistry(final RateLimitSpec spec) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(spec.limit())
                .limitRefreshPeriod(spec.window())
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiterRegistry.of(config);
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.ofDefaults();
    }

    @Bean
    public TimeLimiter searchTimeLimiter(final TimeLimiterRegistry registry, final ApiProperties props) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(props.getRequestTimeout()))
                .cancelRunningFuture(false)
                .build();
        return registry.timeLimiter("registerSearch", config);
    }

    /**
     * Unbounded: an abandoned search keeps its thread until the transport's
     * own timeouts end it.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService portalSearchExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("portal-search-"));
    }
}

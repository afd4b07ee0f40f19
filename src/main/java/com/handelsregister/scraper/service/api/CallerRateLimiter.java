package com.handelsregister.scraper.service.api;

import com.handelsregister.scraper.exception.RateLimitExceededException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-caller request ceiling.
 *
 * <p>Each caller identity gets its own Resilience4j {@link RateLimiter} from
 * the registry, all sharing the default config (fixed window, zero wait).</p>
 *
 * <p>A limiter whose caller has been idle for a whole window holds a full
 * allowance again, so {@link #evictIdle()} drops it from the registry. That
 * keeps the registry bounded by the callers seen in the last window.</p>
 */
@Slf4j
@Getter
@Component
public class CallerRateLimiter {

    private final RateLimiterRegistry registry;

    private final RateLimitSpec spec;

    private final Clock clock;

    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();

    public CallerRateLimiter(final RateLimiterRegistry registry, final RateLimitSpec spec, final Clock clock) {
        this.registry = registry;
        this.spec = spec;
        this.clock = clock;
    }

    /**
     * Consume one permit for {@code caller}.
     *
     * @throws RateLimitExceededException when the window's allowance is used up
     */
    public void acquire(final String caller) {
        lastSeen.put(caller, clock.instant());
        RateLimiter limiter = registry.rateLimiter(caller);
        if (!limiter.acquirePermission()) {
            log.warn("Rate limit {} exceeded by {}", spec.text(), caller);
            throw new RateLimitExceededException(caller, spec.limit() + " per " + describe(spec));
        }
    }

    /**
     * Remove the limiters of callers idle for at least one window.
     *
     * @return number of limiters removed
     */
    @Scheduled(fixedDelayString = "${api.rate-limit-eviction-ms:600000}")
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(spec.window());
        int removed = 0;
        for (Map.Entry<String, Instant> entry : lastSeen.entrySet()) {
            // a caller seen since the entry was read keeps its limiter
            if (!entry.getValue().isAfter(cutoff) && lastSeen.remove(entry.getKey(), entry.getValue())) {
                registry.remove(entry.getKey());
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} idle rate limiters, {} active", removed, lastSeen.size());
        }
        return removed;
    }

    private static String describe(final RateLimitSpec spec) {
        long seconds = spec.window().toSeconds();
        if (seconds % 86_400 == 0) {
            return plural(seconds / 86_400, "day");
        }
        if (seconds % 3_600 == 0) {
            return plural(seconds / 3_600, "hour");
        }
        if (seconds % 60 == 0) {
            return plural(seconds / 60, "minute");
        }
        return plural(seconds, "second");
    }

    private static String plural(final long n, final String unit) {
        return n == 1 ? "1 " + unit : n + " " + unit + "s";
    }
}

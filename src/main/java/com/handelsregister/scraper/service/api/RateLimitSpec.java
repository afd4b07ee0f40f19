package com.handelsregister.scraper.service.api;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed form of a rate limit string such as {@code "100 per hour"},
 * {@code "10/minute"} or {@code "5 per 30 seconds"}.
 *
 * @param limit  requests allowed per window
 * @param window length of the fixed replenishment window
 * @param text   original string, used in error messages
 */
public record RateLimitSpec(int limit, Duration window, String text) {

    private static final Pattern SPEC = Pattern.compile(
            "^\\s*(\\d+)\\s*(?:per|/)\\s*(\\d+)?\\s*(second|minute|hour|day)s?\\s*$",
            Pattern.CASE_INSENSITIVE);

    public static RateLimitSpec parse(final String text) {
        Matcher m = text == null ? null : SPEC.matcher(text);
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException("Unparsable rate limit '" + text
                    + "', expected e.g. '100 per hour' or '10/minute'");
        }
        int limit = Integer.parseInt(m.group(1));
        if (limit < 1) {
            throw new IllegalArgumentException("Rate limit must allow at least one request: " + text);
        }
        long multiplier = m.group(2) == null ? 1 : Long.parseLong(m.group(2));
        ChronoUnit unit = switch (m.group(3).toLowerCase(Locale.ROOT)) {
            case "second" -> ChronoUnit.SECONDS;
            case "minute" -> ChronoUnit.MINUTES;
            case "hour" -> ChronoUnit.HOURS;
            default -> ChronoUnit.DAYS;
        };
        return new RateLimitSpec(limit, unit.getDuration().multipliedBy(multiplier), text.trim());
    }
}

package com.handelsregister.scraper.model;

import java.time.Instant;

/**
 * Claims of a service-to-service token. There is no expiry:
 * a token stays valid for as long as the signing key does.
 *
 * @param service  name of the calling service
 * @param issuedAt issue time, second precision
 */
public record ServiceToken(String service, Instant issuedAt) {
}

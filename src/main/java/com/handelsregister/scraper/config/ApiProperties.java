package com.handelsregister.scraper.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the public REST façade.
 *
 * <p>Values are bound from properties prefixed with {@code api}; the shipped
 * <code>application.yml</code> maps them onto the environment variables
 * {@code JWT_SECRET_KEY}, {@code RATE_LIMIT_DEFAULT} and {@code REQUEST_TIMEOUT}
 * (a <code>.env</code> file in the working directory is honoured too).</p>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "api")
public class ApiProperties {

    /** Fallback signing key. Anyone who knows it can mint tokens. */
    public static final String INSECURE_DEFAULT_SECRET = "default-secret-key-change-in-production";

    /** Symmetric HS256 key for service tokens. */
    @NotBlank
    private String jwtSecretKey = INSECURE_DEFAULT_SECRET;

    /**
     * Per-caller request ceiling, e.g. {@code "100 per hour"} or {@code "10/minute"}.
     */
    @NotBlank
    private String rateLimitDefault = "100 per hour";

    /** Delay between sweeps that drop idle per-caller limiters, in milliseconds. */
    @Min(1)
    private long rateLimitEvictionMs = 600_000;

    /** Wall-clock bound for one search pipeline, in seconds. */
    @Min(1)
    private int requestTimeout = 30;

    /** Name reported by the health endpoint. */
    private String serviceName = "handelsregister-api";

    public boolean usesInsecureDefaultSecret() {
        return INSECURE_DEFAULT_SECRET.equals(jwtSecretKey);
    }
}

package com.handelsregister.scraper.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Binds the register portal section of <code>application.yml</code>.
 * <p>
 * Example YAML:
 * <pre>{@code
 * portal:
 *   base-url: https://www.handelsregister.de
 *   connect-timeout: 10s
 *   response-timeout: 10s
 *   cache-dir: ${java.io.tmpdir}/handelsregister_cache
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "portal")
@Getter
@Setter
public class PortalProperties {

    /**
     * Start page of the portal. The session always enters here to pick up
     * the JSF view state and session cookie.
     */
    private String baseUrl = "https://www.handelsregister.de";

    /** TCP connect timeout for every portal exchange. */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Upper bound for one request/response exchange (redirect hops included).
     * The API-level request timeout is enforced separately.
     */
    private Duration responseTimeout = Duration.ofSeconds(10);

    /** Maximum number of redirects followed for a single exchange. */
    private int maxRedirects = 10;

    /** Browser identity presented to the portal. */
    private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/15.5 Safari/605.1.15";

    private String acceptLanguage = "en-GB,en;q=0.9";

    /** Directory of the keyword result cache, one file per keyword string. */
    private Path cacheDir = Path.of(System.getProperty("java.io.tmpdir"), "handelsregister_cache");
}

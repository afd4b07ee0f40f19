package com.handelsregister.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the Handelsregister scraper.
 *
 * <p>This Spring Boot application exposes RESTful endpoints for:
 * <ul>
 *   <li>company search against the common register portal,</li>
 *   <li>service token issuance,</li>
 *   <li>German state code lookups.</li>
 * </ul>
 * It wires together the portal session, the keyword cache, the result grid
 * parser and Spring MVC controllers.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   mvn spring-boot:run
 *
 *   // Or run the JAR:
 *   java -jar target/handelsregister-scraper-0.1.0-SNAPSHOT.jar
 * }</pre>
 *
 * <p>Once started, the application listens on the configured port (default
 * 5000) and serves requests under <code>/api/</code>.</p>
 */
@SpringBootApplication
public class HandelsregisterScraperApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments, passed on to Spring
     */
    public static void main(final String[] args) {
        SpringApplication.run(HandelsregisterScraperApplication.class, args);
    }
}

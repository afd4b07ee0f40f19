package com.handelsregister.scraper.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.handelsregister.scraper.config.ApiProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated service information: health check and API documentation.
 */
@RestController
@RequestMapping("/api")
public class InfoController {

    private final ApiProperties props;

    private final ObjectNode docsTemplate;

    public InfoController(final ApiProperties props,
                          final ObjectMapper mapper,
                          @Value("classpath:api-docs.json") final Resource docs) {
        this.props = props;
        try (InputStream in = docs.getInputStream()) {
            this.docsTemplate = (ObjectNode) mapper.readTree(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot load API documentation from " + docs, ex);
        }
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("rate_limit", props.getRateLimitDefault());
        config.put("request_timeout", props.getRequestTimeout());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", props.getServiceName());
        body.put("config", config);
        return body;
    }

    /**
     * Static endpoint description with the limits currently in force filled in.
     */
    @GetMapping("/docs")
    public JsonNode docs() {
        ObjectNode docs = docsTemplate.deepCopy();
        section(docs, "rate_limiting").put("default", props.getRateLimitDefault());
        section(docs, "request_timeout").put("value", props.getRequestTimeout() + " seconds");
        ObjectNode env = section(docs, "environment_variables");
        env.put("RATE_LIMIT_DEFAULT", "Rate limit string (default: " + props.getRateLimitDefault() + ")");
        env.put("REQUEST_TIMEOUT", "Request timeout in seconds (default: " + props.getRequestTimeout() + ")");
        return docs;
    }

    private static ObjectNode section(final ObjectNode docs, final String name) {
        return (ObjectNode) docs.get(name);
    }
}

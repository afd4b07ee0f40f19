package com.handelsregister.scraper.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for token issuance.
 *
 * @param serviceName name of the service requesting the token; must not be blank
 */
public record TokenRequest(
        @JsonProperty("service_name")
        @NotBlank(message = "Missing service_name in request body")
        String serviceName
) {
}

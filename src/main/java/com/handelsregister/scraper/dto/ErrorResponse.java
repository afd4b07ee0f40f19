package com.handelsregister.scraper.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error payload shared by all endpoints.
 *
 * @param error   human-readable description
 * @param message additional detail (rate limit in force)
 * @param options acceptable values, for validation errors over a closed set
 * @param hint    suggestion for the caller
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String error, String message, List<String> options, String hint) {

    public static ErrorResponse of(final String error) {
        return new ErrorResponse(error, null, null, null);
    }
}

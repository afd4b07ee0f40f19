package com.handelsregister.scraper.dto;

/**
 * @param token   signed, non-expiring service token
 * @param service service name the token was issued to
 */
public record TokenResponse(String token, String service) {
}

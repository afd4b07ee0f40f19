package com.handelsregister.scraper.controller;

import com.handelsregister.scraper.dto.TokenRequest;
import com.handelsregister.scraper.dto.TokenResponse;
import com.handelsregister.scraper.service.api.ServiceTokenService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Issues service-to-service tokens.
 * <p>
 * Endpoint: <code>POST /api/token</code>, body <code>{"service_name": "my-service"}</code>.
 * No authentication; the tokens never expire.
 * </p>
 */
@RestController
@RequestMapping("/api/token")
@RequiredArgsConstructor
public class TokenController {

    private final ServiceTokenService tokens;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TokenResponse> issue(@RequestBody @Valid final TokenRequest request) {
        String token = tokens.issue(request.serviceName());
        return ResponseEntity.ok(new TokenResponse(token, request.serviceName()));
    }
}

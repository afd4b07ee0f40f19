package com.handelsregister.scraper.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.handelsregister.scraper.config.ApiProperties;
import com.handelsregister.scraper.exception.AuthenticationException;
import com.handelsregister.scraper.model.ServiceToken;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;

/**
 * Issues and verifies service-to-service tokens.
 *
 * <p>Tokens are compact HS256 JWTs with the claims {@code service} and
 * {@code iat} and no {@code exp}; validity rests on the signature alone.
 * Nothing is stored server side.</p>
 */
@Slf4j
@Service
public class ServiceTokenService {

    static final String BEARER_PREFIX = "Bearer ";

    private static final String ALGORITHM = "HS256";
    private static final String HMAC = "HmacSHA256";

    private static final Base64.Encoder B64 = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder B64_DECODER = Base64.getUrlDecoder();

    private final ApiProperties props;

    private final ObjectMapper mapper;

    private final Clock clock;

    public ServiceTokenService(final ApiProperties props,
                               final ObjectMapper mapper,
                               final Clock clock) {
        this.props = props;
        this.mapper = mapper;
        this.clock = clock;
    }

    @PostConstruct
    void warnOnDefaultSecret() {
        if (props.usesInsecureDefaultSecret()) {
            log.warn("JWT_SECRET_KEY is not set; tokens are signed with the public default key. "
                    + "Do not run like this in production.");
        }
    }

    /**
     * @param serviceName name of the calling service, must not be blank
     * @return signed token
     */
    public String issue(final String serviceName) {
        if (StringUtils.isBlank(serviceName)) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
        ObjectNode header = mapper.createObjectNode()
                .put("alg", ALGORITHM)
                .put("typ", "JWT");
        ObjectNode claims = mapper.createObjectNode()
                .put("service", serviceName)
                .put("iat", Instant.now(clock).getEpochSecond());

        String signingInput = encode(header) + "." + encode(claims);
        String token = signingInput + "." + B64.encodeToString(sign(signingInput));
        log.info("Issued service token for '{}'", serviceName);
        return token;
    }

    /**
     * Verify the value of an {@code Authorization} header (or a bare token).
     *
     * @throws AuthenticationException with a reason that tells the cases apart
     */
    public ServiceToken verifyHeader(final String authorization) {
        if (authorization == null || authorization.isBlank()) {
            throw new AuthenticationException("Missing authentication token");
        }
        String token = authorization;
        if (authorization.startsWith(BEARER_PREFIX)) {
            token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (token.isEmpty() || token.contains(" ")) {
                throw new AuthenticationException("Invalid Authorization header format");
            }
        }
        return verify(token.trim());
    }

    /**
     * Verify a bare token.
     */
    public ServiceToken verify(final String token) {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw invalid("Not enough segments");
        }

        JsonNode header = decode(parts[0], "header");
        if (!ALGORITHM.equals(header.path("alg").asText())) {
            throw invalid("The specified alg value is not allowed");
        }

        byte[] signature;
        try {
            signature = B64_DECODER.decode(parts[2]);
        } catch (IllegalArgumentException ex) {
            throw invalid("Invalid crypto padding");
        }
        byte[] expected = sign(parts[0] + "." + parts[1]);
        if (!MessageDigest.isEqual(expected, signature)) {
            throw invalid("Signature verification failed");
        }

        JsonNode claims = decode(parts[1], "payload");
        String service = claims.path("service").asText(null);
        if (service == null) {
            throw invalid("Missing service claim");
        }
        Instant issuedAt = claims.path("iat").isNumber()
                ? Instant.ofEpochSecond(claims.path("iat").asLong())
                : null;
        return new ServiceToken(service, issuedAt);
    }

    private String encode(final JsonNode node) {
        try {
            return B64.encodeToString(mapper.writeValueAsBytes(node));
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot serialise token segment", ex);
        }
    }

    private JsonNode decode(final String segment, final String what) {
        try {
            JsonNode node = mapper.readTree(B64_DECODER.decode(segment));
            if (node == null || !node.isObject()) {
                throw invalid("Invalid " + what + " segment");
            }
            return node;
        } catch (IllegalArgumentException | IOException ex) {
            throw invalid("Invalid " + what + " padding or JSON");
        }
    }

    private byte[] sign(final String signingInput) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(props.getJwtSecretKey().getBytes(StandardCharsets.UTF_8), HMAC));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC computation failed", ex);
        }
    }

    private static AuthenticationException invalid(final String why) {
        return new AuthenticationException("Invalid token: " + why);
    }
}

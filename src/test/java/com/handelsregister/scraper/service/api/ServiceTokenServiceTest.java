package com.handelsregister.scraper.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.handelsregister.scraper.config.ApiProperties;
import com.handelsregister.scraper.exception.AuthenticationException;
import com.handelsregister.scraper.model.ServiceToken;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceTokenServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private final ServiceTokenService service = service("test-secret");

    private static ServiceTokenService service(final String secret) {
        ApiProperties props = new ApiProperties();
        props.setJwtSecretKey(secret);
        return new ServiceTokenService(props, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void issuedTokenVerifies() {
        String token = service.issue("billing");

        ServiceToken verified = service.verify(token);
        assertThat(verified.service()).isEqualTo("billing");
        assertThat(verified.issuedAt()).isEqualTo(NOW);
    }

    @Test
    void tokenIsCompactHs256Jwt() {
        String token = service.issue("billing");

        String[] parts = token.split("\\.");
        assertThat(parts).hasSize(3);
        String header = new String(Base64.getUrlDecoder().decode(parts[0]), StandardCharsets.UTF_8);
        String claims = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
        assertThat(header).contains("\"alg\":\"HS256\"");
        assertThat(claims).contains("\"service\":\"billing\"").contains("\"iat\":" + NOW.getEpochSecond())
                .doesNotContain("exp");
        assertThat(token).doesNotContain("=");
    }

    @Test
    void acceptsBearerAndBareToken() {
        String token = service.issue("billing");

        assertThat(service.verifyHeader("Bearer " + token).service()).isEqualTo("billing");
        assertThat(service.verifyHeader(token).service()).isEqualTo("billing");
    }

    @Test
    void tokenFromOtherKeyIsRejected() {
        String foreign = service("other-secret").issue("billing");

        assertThatThrownBy(() -> service.verify(foreign))
                .isInstanceOf(AuthenticationException.class)
                .hasMessage("Invalid token: Signature verification failed");
    }

    @Test
    void tamperedClaimsAreRejected() {
        String[] parts = service.issue("billing").split("\\.");
        String forged = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"service\":\"admin\",\"iat\":0}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> service.verify(parts[0] + "." + forged + "." + parts[2]))
                .hasMessage("Invalid token: Signature verification failed");
    }

    @Test
    void missingHeaderIsDistinguished() {
        assertThatThrownBy(() -> service.verifyHeader(null))
                .isInstanceOf(AuthenticationException.class)
                .hasMessage("Missing authentication token");
        assertThatThrownBy(() -> service.verifyHeader("  "))
                .hasMessage("Missing authentication token");
    }

    @Test
    void malformedBearerHeaderIsDistinguished() {
        assertThatThrownBy(() -> service.verifyHeader("Bearer "))
                .hasMessage("Invalid Authorization header format");
        assertThatThrownBy(() -> service.verifyHeader("Bearer a b"))
                .hasMessage("Invalid Authorization header format");
    }

    @Test
    void garbageTokenIsInvalid() {
        assertThatThrownBy(() -> service.verifyHeader("Bearer not-a-token"))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageStartingWith("Invalid token: ");
    }

    @Test
    void blankServiceNameCannotBeIssued() {
        assertThatThrownBy(() -> service.issue(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

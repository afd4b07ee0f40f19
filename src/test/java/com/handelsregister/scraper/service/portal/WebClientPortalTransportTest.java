package com.handelsregister.scraper.service.portal;

import com.handelsregister.scraper.exception.PortalTransportException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientPortalTransportTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private final Deque<ClientResponse> responses = new ArrayDeque<>();

    private WebClientPortalTransport transport(final int maxRedirects) {
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> {
                    requests.add(req);
                    ClientResponse next = responses.poll();
                    return next == null ? Mono.error(new IllegalStateException("no response queued")) : Mono.just(next);
                })
                .build();
        return new WebClientPortalTransport(client, Duration.ofSeconds(5), maxRedirects);
    }

    @Test
    void postRedirectContinuesAsGetWithSessionCookie() {
        responses.add(ClientResponse.create(HttpStatus.FOUND)
                .header("Location", "/rp_web/result.xhtml")
                .cookie("JSESSIONID", "abc")
                .build());
        responses.add(ClientResponse.create(HttpStatus.OK)
                .header("Content-Type", "text/html")
                .body("<html><title>Ergebnis</title></html>")
                .build());

        MultiValueMap<String, String> fields = new LinkedMultiValueMap<>();
        fields.add("form:schlagwoerter", "Gasag");
        PortalPage page = transport(10).submit(
                new FormSubmission(URI.create("https://portal.test/rp_web/search.xhtml"), HttpMethod.POST, fields));

        assertThat(page.getUrl()).isEqualTo(URI.create("https://portal.test/rp_web/result.xhtml"));
        assertThat(page.title()).isEqualTo("Ergebnis");
        assertThat(requests).hasSize(2);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(1).method()).isEqualTo(HttpMethod.GET);
        assertThat(requests.get(1).cookies().getFirst("JSESSIONID")).isEqualTo("abc");
    }

    @Test
    void cookiesPersistAcrossCalls() {
        WebClientPortalTransport transport = transport(10);
        responses.add(ClientResponse.create(HttpStatus.OK).cookie("JSESSIONID", "s1").body("a").build());
        responses.add(ClientResponse.create(HttpStatus.OK).body("b").build());

        transport.fetch(URI.create("https://portal.test/"));
        transport.fetch(URI.create("https://portal.test/other"));

        assertThat(requests.get(0).cookies()).isEmpty();
        assertThat(requests.get(1).cookies().getFirst("JSESSIONID")).isEqualTo("s1");
    }

    @Test
    void decodesDeclaredCharset() {
        byte[] latin1 = "<p>Thüringen</p>".getBytes(StandardCharsets.ISO_8859_1);
        responses.add(ClientResponse.create(HttpStatus.OK)
                .header("Content-Type", "text/html; charset=ISO-8859-1")
                .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(latin1)))
                .build());

        PortalPage page = transport(10).fetch(URI.create("https://portal.test/"));

        assertThat(page.getHtml()).isEqualTo("<p>Thüringen</p>");
    }

    @Test
    void errorStatusIsTransportFailure() {
        responses.add(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).body("down").build());

        assertThatThrownBy(() -> transport(10).fetch(URI.create("https://portal.test/")))
                .isInstanceOf(PortalTransportException.class)
                .hasMessage("HTTP 503 for https://portal.test/");
    }

    @Test
    void redirectLoopIsBounded() {
        for (int i = 0; i < 3; i++) {
            responses.add(ClientResponse.create(HttpStatus.FOUND).header("Location", "/again").build());
        }

        assertThatThrownBy(() -> transport(2).fetch(URI.create("https://portal.test/")))
                .isInstanceOf(PortalTransportException.class)
                .hasMessageContaining("More than 2 redirects");
        assertThat(requests).hasSize(3);
    }

    @Test
    void networkErrorIsTransportFailure() {
        assertThatThrownBy(() -> transport(10).fetch(URI.create("https://portal.test/")))
                .isInstanceOf(PortalTransportException.class)
                .hasMessageContaining("no response queued");
    }

    @Test
    void getSubmissionEncodesFieldsIntoQuery() {
        MultiValueMap<String, String> fields = new LinkedMultiValueMap<>();
        fields.add("q", "Gasag AG");
        fields.add("state", "BE");

        URI uri = WebClientPortalTransport.withQuery(URI.create("https://portal.test/find?old=1"), fields);

        assertThat(uri.toString()).isEqualTo("https://portal.test/find?q=Gasag+AG&state=BE");
    }
}

package com.handelsregister.scraper.service.portal;

import com.handelsregister.scraper.exception.PortalTransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link PortalTransport} on top of the shared portal {@link WebClient}.
 *
 * <ul>
 *   <li>Own cookie jar per instance; every response's {@code Set-Cookie} is
 *       replayed on the next request.</li>
 *   <li>Redirects are followed here rather than by Netty so that the final
 *       URL is known (relative form actions resolve against it). 301/302/303
 *       continue as GET without body, 307/308 repeat the request.</li>
 *   <li>Bodies are decoded with the declared charset, UTF-8 otherwise.</li>
 * </ul>
 */
@Slf4j
public class WebClientPortalTransport implements PortalTransport {

    private final WebClient client;

    private final Duration timeout;

    private final int maxRedirects;

    private final Map<String, String> cookies = new ConcurrentHashMap<>();

    public WebClientPortalTransport(final WebClient client, final Duration timeout, final int maxRedirects) {
        this.client = client;
        this.timeout = timeout;
        this.maxRedirects = maxRedirects;
    }

    @Override
    public PortalPage fetch(final URI uri) {
        return exchange(HttpMethod.GET, uri, null);
    }

    @Override
    public PortalPage submit(final FormSubmission submission) {
        if (HttpMethod.GET.equals(submission.method())) {
            return exchange(HttpMethod.GET, withQuery(submission.action(), submission.fields()), null);
        }
        return exchange(submission.method(), submission.action(), submission.fields());
    }

    private PortalPage exchange(final HttpMethod method, final URI uri,
                                final MultiValueMap<String, String> form) {
        HttpMethod currentMethod = method;
        URI target = uri;
        MultiValueMap<String, String> body = form;

        for (int hop = 0; hop <= maxRedirects; hop++) {
            RawResponse rsp = send(currentMethod, target, body);
            HttpStatusCode status = rsp.status();

            if (status.is3xxRedirection() && rsp.location() != null) {
                target = target.resolve(rsp.location());
                if (status.value() != HttpStatus.TEMPORARY_REDIRECT.value()
                        && status.value() != HttpStatus.PERMANENT_REDIRECT.value()) {
                    currentMethod = HttpMethod.GET;
                    body = null;
                }
                continue;
            }
            if (!status.is2xxSuccessful()) {
                throw new PortalTransportException("HTTP " + status.value() + " for " + target);
            }
            return new PortalPage(target, rsp.body());
        }
        throw new PortalTransportException("More than " + maxRedirects + " redirects for " + uri);
    }

    private RawResponse send(final HttpMethod method, final URI uri,
                             final MultiValueMap<String, String> form) {
        log.debug("--> {} {} cookies={}", method, uri, cookies.keySet());

        WebClient.RequestBodySpec spec = client.method(method)
                .uri(uri)
                .cookies(c -> cookies.forEach(c::add));
        WebClient.RequestHeadersSpec<?> request = (form == null)
                ? spec
                : spec.contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .body(BodyInserters.fromFormData(form));

        RawResponse rsp;
        try {
            rsp = request.exchangeToMono(this::read)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException ex) {
            throw new PortalTransportException(method + " " + uri + " failed: " + ex.getMessage(), ex);
        }
        if (rsp == null) {
            throw new PortalTransportException("No response for " + method + " " + uri);
        }
        log.debug("<-- {} {} ({} chars)", rsp.status().value(), uri, rsp.body().length());
        return rsp;
    }

    private Mono<RawResponse> read(final ClientResponse resp) {
        resp.cookies().values().stream()
                .flatMap(Collection::stream)
                .forEach(this::remember);

        Charset charset = resp.headers().contentType()
                .map(MediaType::getCharset)
                .filter(Objects::nonNull)
                .orElse(StandardCharsets.UTF_8);
        URI location = resp.headers().asHttpHeaders().getLocation();

        return resp.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(bytes -> new RawResponse(resp.statusCode(), location, new String(bytes, charset)));
    }

    private void remember(final ResponseCookie cookie) {
        if (cookie.getMaxAge().isZero()) {
            cookies.remove(cookie.getName());
        } else {
            cookies.put(cookie.getName(), cookie.getValue());
        }
    }

    static URI withQuery(final URI action, final MultiValueMap<String, String> fields) {
        String base = action.toString();
        int q = base.indexOf('?');
        if (q >= 0) {
            base = base.substring(0, q);
        }
        String query = fields.entrySet().stream()
                .flatMap(e -> e.getValue().stream().map(v -> encode(e.getKey()) + "=" + encode(v)))
                .collect(Collectors.joining("&"));
        return URI.create(query.isEmpty() ? base : base + "?" + query);
    }

    private static String encode(final String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private record RawResponse(HttpStatusCode status, URI location, String body) {
    }
}

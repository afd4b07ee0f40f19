package com.handelsregister.scraper.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * The {@link WebClient} every portal session talks through.
 * <p>
 * Presents itself as a desktop Safari, accepts gzip, and leaves redirects and
 * cookies to the session's transport. Result pages can be large, hence the
 * raised in-memory buffer.
 * </p>
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final int MAX_CONNECTIONS = 50;
    private static final Duration POOL_ACQUIRE_TIMEOUT = Duration.ofSeconds(2);
    private static final int MAX_IN_MEMORY_BYTES = 8 * 1024 * 1024;

    @Bean
    public WebClient portalWebClient(final PortalProperties props) {

        ConnectionProvider pool = ConnectionProvider.builder("portal-pool")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(POOL_ACQUIRE_TIMEOUT)
                .build();

        HttpClient httpClient = HttpClient.create(pool)
                .compress(true)
                .followRedirect(false)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) props.getConnectTimeout().toMillis())
                .responseTimeout(props.getResponseTimeout())
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);

        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .defaultHeaders(h -> {
                    h.set(HttpHeaders.USER_AGENT, props.getUserAgent());
                    h.set(HttpHeaders.ACCEPT_LANGUAGE, props.getAcceptLanguage());
                    h.set(HttpHeaders.ACCEPT,
                            "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
                    h.set(HttpHeaders.CONNECTION, "keep-alive");
                })
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}  {}", req.method(), req.url(), req.headers());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().asHttpHeaders());
            return Mono.just(res);
        });
    }
}

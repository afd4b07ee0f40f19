package com.handelsregister.scraper.service.portal;

import com.handelsregister.scraper.config.PortalProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;

/**
 * Hands out fresh {@link RegistryPortalSession}s. The Netty connection pool
 * behind {@code portalWebClient} is shared; cookies are not.
 */
@Component
public class RegistryPortalSessionFactory {

    private final WebClient portalWebClient;

    private final PortalProperties props;

    public RegistryPortalSessionFactory(@Qualifier("portalWebClient") final WebClient portalWebClient,
                                        final PortalProperties props) {
        this.portalWebClient = portalWebClient;
        this.props = props;
    }

    public RegistryPortalSession newSession() {
        PortalTransport transport = new WebClientPortalTransport(
                portalWebClient, props.getResponseTimeout(), props.getMaxRedirects());
        return new RegistryPortalSession(transport, URI.create(props.getBaseUrl()));
    }
}

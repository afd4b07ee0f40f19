package com.handelsregister.scraper.service.portal;

import lombok.Getter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.net.URI;

/**
 * A page as delivered by the portal: final URL after redirects plus the raw
 * markup. The jsoup tree is built on first use and resolves relative form
 * actions against {@link #getUrl()}.
 */
@Getter
public final class PortalPage {

    private final URI url;

    private final String html;

    private Document document;

    public PortalPage(final URI url, final String html) {
        this.url = url;
        this.html = html == null ? "" : html;
    }

    public Document document() {
        if (document == null) {
            document = Jsoup.parse(html, url.toString());
        }
        return document;
    }

    public String title() {
        return document().title();
    }
}

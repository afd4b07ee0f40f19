package com.handelsregister.scraper.service.portal;

import com.handelsregister.scraper.exception.PortalConnectException;
import com.handelsregister.scraper.exception.PortalStructureException;
import com.handelsregister.scraper.exception.PortalTransportException;
import com.handelsregister.scraper.model.SearchQuery;
import com.handelsregister.scraper.model.StateCode;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * One browser session against the register portal.
 *
 * <p>The portal is a JSF application without an API, so a search replays what
 * a person does in the browser:</p>
 * <ol>
 *   <li>{@link #open()} loads the start page (session cookie, view state).</li>
 *   <li>The navigation form {@code naviForm} is posted with the two hidden
 *       fields the "advanced search" link would add via JavaScript.</li>
 *   <li>The advanced search form is filled in and submitted.</li>
 * </ol>
 *
 * <p>A session is used for a single search and is not thread-safe. It never
 * touches the result cache.</p>
 */
@Slf4j
public class RegistryPortalSession {

    static final String NAVIGATION_FORM = "naviForm";
    static final String ADVANCED_SEARCH_LINK = "naviForm:erweiterteSucheLink";
    static final String TARGET_FIELD = "target";
    static final String ADVANCED_SEARCH_TARGET = "erweiterteSucheLink";

    private final PortalTransport transport;

    private final URI startPage;

    private PortalPage current;

    public RegistryPortalSession(final PortalTransport transport, final URI startPage) {
        this.transport = transport;
        this.startPage = startPage;
    }

    /**
     * Load the portal start page.
     *
     * @throws PortalConnectException if the portal cannot be reached
     */
    public void open() {
        try {
            current = transport.fetch(startPage);
        } catch (PortalTransportException ex) {
            throw new PortalConnectException("Cannot open register portal " + startPage
                    + ": " + ex.getMessage(), ex);
        }
        log.debug("Portal session opened at {}", current.getUrl());
    }

    /**
     * Run the advanced search for {@code query}.
     *
     * @return raw result page and warnings for state filters that could not be applied
     * @throws PortalStructureException if a required form or control is missing
     * @throws PortalTransportException on network failure
     */
    public PortalSearchResult submitSearch(final SearchQuery query) {
        if (current == null) {
            throw new IllegalStateException("Session not opened");
        }

        PortalForm navigation = PortalForm.find(current, NAVIGATION_FORM)
                .orElseThrow(() -> new PortalStructureException(
                        "Navigation form '" + NAVIGATION_FORM + "' not found on " + current.getUrl()));
        navigation.addHidden(ADVANCED_SEARCH_LINK, ADVANCED_SEARCH_LINK);
        navigation.addHidden(TARGET_FIELD, ADVANCED_SEARCH_TARGET);
        current = transport.submit(navigation.toSubmission());
        trace(query, "advanced search page: {}", current.title());

        SearchForm form = SearchForm.on(current);
        form.setKeywords(query.keywords());
        form.setMatchMode(query.matchMode());

        List<String> warnings = new ArrayList<>();
        for (StateCode state : query.stateFilter()) {
            FieldOutcome outcome = form.setStateFilter(state);
            if (!outcome.applied()) {
                warnings.add("Could not set bundesland " + state.name() + " (" + outcome.describe() + ")");
                trace(query, "state filter {} not applied: {}", state, outcome.detail());
            }
        }

        current = transport.submit(form.toSubmission());
        trace(query, "result page: {}", current.title());
        return new PortalSearchResult(current.getHtml(), warnings);
    }

    private static void trace(final SearchQuery query, final String format, final Object... args) {
        if (query.debug()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}

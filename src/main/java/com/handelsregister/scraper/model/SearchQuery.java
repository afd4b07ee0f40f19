package com.handelsregister.scraper.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One company search as submitted to the portal.
 *
 * @param keywords    search terms; also the literal cache key
 * @param matchMode   how the portal combines the keywords
 * @param stateFilter states to restrict the search to, in request order; empty for all states
 * @param bypassCache fetch fresh even when a cached document exists
 * @param debug       log protocol details at INFO
 */
public record SearchQuery(
        String keywords,
        MatchMode matchMode,
        Set<StateCode> stateFilter,
        boolean bypassCache,
        boolean debug
) {

    public SearchQuery {
        if (StringUtils.isBlank(keywords)) {
            throw new IllegalArgumentException("keywords must not be blank");
        }
        Objects.requireNonNull(matchMode, "matchMode");
        stateFilter = stateFilter == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(stateFilter));
    }

    public static SearchQuery of(final String keywords, final MatchMode matchMode) {
        return new SearchQuery(keywords, matchMode, Set.of(), false, false);
    }
}

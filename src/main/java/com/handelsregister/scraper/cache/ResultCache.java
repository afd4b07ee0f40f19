package com.handelsregister.scraper.cache;

import java.util.Optional;

/**
 * Keyword-keyed store of raw result documents.
 * <p>
 * Keys are the literal keyword strings of a search: not trimmed, not
 * case-folded and not qualified by match mode or state filter. Two searches
 * that differ only in mode or states therefore share one entry. Entries never
 * expire and are only replaced by a forced (cache-bypassing) search.
 * </p>
 */
public interface ResultCache {

    /**
     * @param key literal keyword string
     * @return the cached document, or empty on a miss
     */
    Optional<String> get(String key);

    /**
     * Store {@code document} under {@code key}, replacing any previous entry.
     * Concurrent writers to the same key race; the last one wins.
     *
     * @param key      literal keyword string
     * @param document raw HTML as fetched from the portal
     */
    void put(String key, String document);
}

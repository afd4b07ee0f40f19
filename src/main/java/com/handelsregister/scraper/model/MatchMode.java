package com.handelsregister.scraper.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Keyword matching semantics offered by the portal's advanced search.
 */
@Getter
public enum MatchMode {

    /** Every keyword must occur in the company name. */
    ALL("all", 1),

    /** At least one keyword must occur. */
    ANY("min", 2),

    /** The company name must match exactly. */
    EXACT("exact", 3);

    /** Value accepted by the {@code mode} request parameter. */
    private final String parameter;

    /** Value of the {@code form:schlagwortOptionen} radio button on the portal. */
    private final int portalCode;

    MatchMode(final String parameter, final int portalCode) {
        this.parameter = parameter;
        this.portalCode = portalCode;
    }

    public static Optional<MatchMode> fromParameter(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.parameter.equals(normalized))
                .findFirst();
    }

    public static List<String> parameters() {
        return Arrays.stream(values()).map(MatchMode::getParameter).toList();
    }
}

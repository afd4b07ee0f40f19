package com.handelsregister.scraper.state;

import com.handelsregister.scraper.model.StateCode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static lookup between state codes, canonical German names and the German /
 * English spellings people actually type.
 *
 * <p>Resolution trims and lower-cases the input, then tries</p>
 * <ol>
 *   <li>an exact (case-insensitive) two-letter code,</li>
 *   <li>the alias table built from every {@link StateCode}'s canonical name and aliases.</li>
 * </ol>
 * <p>Anything else is "not found"; there is no prefix or fuzzy matching.</p>
 */
@Component
public class StateRegistry {

    private static final Map<String, StateCode> BY_ALIAS = buildAliasTable();

    /**
     * Resolve a code or a state name.
     *
     * @param nameOrCode e.g. {@code "BE"}, {@code "berlin"}, {@code "North Rhine-Westphalia"}
     * @return the matching state, or empty
     */
    public Optional<StateCode> resolve(final String nameOrCode) {
        if (StringUtils.isBlank(nameOrCode)) {
            return Optional.empty();
        }
        String normalized = nameOrCode.trim().toLowerCase(Locale.ROOT);

        Optional<StateCode> byCode = Arrays.stream(StateCode.values())
                .filter(c -> c.name().equalsIgnoreCase(normalized))
                .findFirst();
        if (byCode.isPresent()) {
            return byCode;
        }
        return Optional.ofNullable(BY_ALIAS.get(normalized));
    }

    /**
     * @return all states in declaration order
     */
    public List<StateCode> list() {
        return List.of(StateCode.values());
    }

    private static Map<String, StateCode> buildAliasTable() {
        Map<String, StateCode> table = new HashMap<>();
        for (StateCode code : StateCode.values()) {
            table.put(code.getNameDe().toLowerCase(Locale.ROOT), code);
            code.getAliases().forEach(alias -> table.put(alias, code));
        }
        return Collections.unmodifiableMap(table);
    }
}

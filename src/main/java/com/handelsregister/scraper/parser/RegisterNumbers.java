package com.handelsregister.scraper.parser;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Register number detection and normalisation.
 *
 * <p>The court cell reads like {@code "Berlin (Charlottenburg) HRB 12345"}.
 * The number is one of the register types HRA, HRB, GnR, VR or PR, followed by
 * digits and an optional single capital letter suffix. The trailing look-ahead
 * stops a following word such as {@code "Formerly"} from being read as a suffix.</p>
 *
 * <p>Some courts omit the suffix their numbers officially carry. The override
 * table appends it, keyed by the state name as the portal renders it.</p>
 */
public final class RegisterNumbers {

    static final Pattern REGISTER_NUMBER =
            Pattern.compile("(HRA|HRB|GnR|VR|PR)\\s*\\d+(\\s+[A-Z])?(?!\\w)");

    private static final Map<String, Map<String, String>> SUFFIXES = Map.of(
            "Berlin", Map.of("HRB", " B"),
            "Bremen", Map.of(
                    "HRA", " HB",
                    "HRB", " HB",
                    "GnR", " HB",
                    "VR", " HB",
                    "PR", " HB"));

    private RegisterNumbers() {
    }

    /**
     * Find the register number in a court cell and apply the state suffix rule.
     *
     * @param court text of the court cell
     * @param state state cell of the same row
     * @return normalised register number, or empty when the cell contains none
     */
    public static Optional<String> extract(final String court, final String state) {
        if (court == null) {
            return Optional.empty();
        }
        Matcher m = REGISTER_NUMBER.matcher(court);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(withStateSuffix(m.group(0), m.group(1), state));
    }

    static String withStateSuffix(final String number, final String type, final String state) {
        String suffix = SUFFIXES.getOrDefault(state, Map.of()).get(type);
        if (suffix == null || number.endsWith(suffix)) {
            return number;
        }
        return number + suffix;
    }
}

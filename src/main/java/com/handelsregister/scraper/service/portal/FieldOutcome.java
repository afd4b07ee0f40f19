package com.handelsregister.scraper.service.portal;

/**
 * Result of setting one form control.
 *
 * @param control control name
 * @param applied whether the value was set
 * @param detail  why not, when {@code applied} is false
 */
public record FieldOutcome(String control, boolean applied, String detail) {

    public static FieldOutcome applied(final String control) {
        return new FieldOutcome(control, true, null);
    }

    public static FieldOutcome missing(final String control) {
        return new FieldOutcome(control, false, "control not found");
    }

    public static FieldOutcome rejected(final String control, final String value) {
        return new FieldOutcome(control, false, "value '" + value + "' not offered");
    }

    public String describe() {
        return applied ? control + ": set" : control + ": " + detail;
    }
}

package com.handelsregister.scraper.model;

import lombok.Getter;

import java.util.List;

/**
 * The sixteen German federal states as the register portal knows them.
 * <p>
 * Declaration order is the order the portal lists them and the order
 * {@code /api/bundesland/list} returns them in. Codes follow the portal's own
 * form field names, hence {@code BR} (not {@code BB}) for Brandenburg.
 * </p>
 */
@Getter
public enum StateCode {

    BW("Baden-Württemberg",
            "baden-wuerttemberg", "baden württemberg", "baden wuerttemberg"),
    BY("Bayern", "bavaria"),
    BE("Berlin"),
    BR("Brandenburg"),
    HB("Bremen"),
    HH("Hamburg"),
    HE("Hessen", "hesse"),
    MV("Mecklenburg-Vorpommern",
            "mecklenburg vorpommern", "mecklenburg-western pomerania", "mecklenburg western pomerania"),
    NI("Niedersachsen", "lower saxony"),
    NW("Nordrhein-Westfalen",
            "nordrhein westfalen", "north rhine-westphalia", "north rhine westphalia"),
    RP("Rheinland-Pfalz",
            "rheinland pfalz", "rhineland-palatinate", "rhineland palatinate"),
    SL("Saarland"),
    SN("Sachsen", "saxony"),
    ST("Sachsen-Anhalt", "sachsen anhalt", "saxony-anhalt", "saxony anhalt"),
    SH("Schleswig-Holstein", "schleswig holstein"),
    TH("Thüringen", "thueringen", "thuringia");

    /** Prefix of the per-state checkbox on the portal's advanced search form. */
    public static final String FORM_FIELD_PREFIX = "bundesland";

    /** Canonical German name, exactly as the portal renders it. */
    private final String nameDe;

    /** Lower-case alternative spellings (transliterations, English names). */
    private final List<String> aliases;

    StateCode(final String nameDe, final String... aliases) {
        this.nameDe = nameDe;
        this.aliases = List.of(aliases);
    }

    /**
     * @return the portal's form control suffix for this state, e.g. {@code bundeslandBE}
     */
    public String formField() {
        return FORM_FIELD_PREFIX + name();
    }
}

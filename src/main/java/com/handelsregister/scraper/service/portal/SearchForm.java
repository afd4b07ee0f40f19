package com.handelsregister.scraper.service.portal;

import com.handelsregister.scraper.exception.PortalStructureException;
import com.handelsregister.scraper.model.MatchMode;
import com.handelsregister.scraper.model.StateCode;

/**
 * Typed view of the portal's advanced search form ({@code form}).
 *
 * <p>Keywords and match mode are mandatory: if their controls are gone the
 * portal changed and {@link PortalStructureException} is thrown. State
 * checkboxes are optional and report a {@link FieldOutcome} instead.</p>
 */
public final class SearchForm {

    static final String FORM_NAME = "form";
    static final String KEYWORDS = "form:schlagwoerter";
    static final String MATCH_MODE = "form:schlagwortOptionen";
    static final String STATE_PREFIX = "form:";

    private final PortalForm form;

    private SearchForm(final PortalForm form) {
        this.form = form;
    }

    public static SearchForm on(final PortalPage page) {
        return PortalForm.find(page, FORM_NAME)
                .map(SearchForm::new)
                .orElseThrow(() -> new PortalStructureException(
                        "Advanced search form '" + FORM_NAME + "' not found on " + page.getUrl()));
    }

    public void setKeywords(final String keywords) {
        require(form.set(KEYWORDS, keywords));
    }

    public void setMatchMode(final MatchMode mode) {
        require(form.set(MATCH_MODE, String.valueOf(mode.getPortalCode())));
    }

    public FieldOutcome setStateFilter(final StateCode state) {
        return form.check(STATE_PREFIX + state.formField());
    }

    public FormSubmission toSubmission() {
        return form.toSubmission();
    }

    private static void require(final FieldOutcome outcome) {
        if (!outcome.applied()) {
            throw new PortalStructureException("Search form changed: " + outcome.describe());
        }
    }
}

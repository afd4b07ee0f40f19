package com.handelsregister.scraper.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.handelsregister.scraper.model.StateCode;

/**
 * State lookup / listing entry.
 *
 * @param code      two-letter code
 * @param nameDe    canonical German name
 * @param input     what the caller asked for; only present on lookups
 * @param formField name of the state's checkbox on the portal form
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"code", "name_de", "input", "form_field"})
public record StateInfo(
        String code,
        @JsonProperty("name_de") String nameDe,
        String input,
        @JsonProperty("form_field") String formField
) {

    public static StateInfo of(final StateCode state) {
        return new StateInfo(state.name(), state.getNameDe(), null, state.formField());
    }

    public static StateInfo lookup(final StateCode state, final String input) {
        return new StateInfo(state.name(), state.getNameDe(), input, state.formField());
    }
}

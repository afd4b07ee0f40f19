package com.handelsregister.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One row of the portal's result grid.
 *
 * @param court            register court cell, verbatim (includes the register number)
 * @param registerNumber   normalised register number, {@code null} when the court cell carries none
 * @param name             company name
 * @param state            federal state as rendered by the portal
 * @param status           registration status, verbatim
 * @param statusNormalized status in upper case with spaces replaced by underscores
 * @param documentsInfo    text of the documents cell
 * @param history          former names and seats, oldest layout first as rendered
 */
@JsonPropertyOrder({"court", "register_num", "name", "state", "status", "statusCurrent", "documents", "history"})
public record Company(
        String court,
        @JsonProperty("register_num") String registerNumber,
        String name,
        String state,
        String status,
        @JsonProperty("statusCurrent") String statusNormalized,
        @JsonProperty("documents") String documentsInfo,
        List<HistoryEntry> history
) {

    public Company {
        history = history == null ? List.of() : List.copyOf(history);
    }
}

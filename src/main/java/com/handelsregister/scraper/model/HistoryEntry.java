package com.handelsregister.scraper.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A former name of a company together with the seat it had under that name.
 * Serialised as a two-element array {@code [name, location]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"name", "location"})
public record HistoryEntry(String name, String location) {
}

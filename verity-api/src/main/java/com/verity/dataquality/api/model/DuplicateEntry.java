package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A record whose composite key was already seen earlier in the dataset.
 *
 * @param rowIndex          row of this (second or later) occurrence
 * @param firstSeenRowIndex row of the canonical first occurrence
 */
public record DuplicateEntry(
    @JsonProperty("row_index") int rowIndex,
    @JsonProperty("first_seen_row_index") int firstSeenRowIndex,
    @JsonProperty("key_fields") List<String> keyFields,
    @JsonProperty("key_values") List<String> keyValues
) implements Serializable {

    public DuplicateEntry {
        keyFields = List.copyOf(keyFields);
        keyValues = List.copyOf(keyValues);
    }
}

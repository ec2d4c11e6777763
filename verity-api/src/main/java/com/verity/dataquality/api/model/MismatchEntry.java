package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A key present on both sides whose non-key fields differ. Only produced in
 * strict comparisons, and only with at least one diff.
 */
public record MismatchEntry(
    @JsonProperty("composite_key") String compositeKey,
    @JsonProperty("source_row_index") int sourceRowIndex,
    @JsonProperty("destination_row_index") int destinationRowIndex,
    @JsonProperty("key_values") List<String> keyValues,
    @JsonProperty("field_diffs") List<FieldDiff> fieldDiffs
) implements Serializable {

    public MismatchEntry {
        keyValues = List.copyOf(keyValues);
        fieldDiffs = List.copyOf(fieldDiffs);
    }
}

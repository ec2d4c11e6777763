package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A record present on only one side of a reconciliation.
 *
 * @param compositeKey display form of the record's key
 * @param rowIndex     row of the record on the side it was found
 */
public record MatchEntry(
    @JsonProperty("composite_key") String compositeKey,
    @JsonProperty("row_index") int rowIndex,
    @JsonProperty("key_values") List<String> keyValues
) implements Serializable {

    public MatchEntry {
        keyValues = List.copyOf(keyValues);
    }
}

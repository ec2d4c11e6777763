package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Representational defects found in one record. These never make a record invalid.
 */
public record FormattingIssue(
    @JsonProperty("row_index") int rowIndex,
    @JsonProperty("issues") List<String> issues
) implements Serializable {

    public FormattingIssue {
        issues = List.copyOf(issues);
    }
}

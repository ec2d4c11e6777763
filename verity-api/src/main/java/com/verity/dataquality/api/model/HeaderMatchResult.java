package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Comparison of the expected column set against the columns actually present.
 *
 * <p>Matching is case-sensitive. {@code caseMismatches} lists pairs that would
 * have matched ignoring case, as a remediation hint; both sides of such a pair
 * also appear in {@code missing} and {@code unexpected}.
 */
@JsonIgnoreProperties(value = "exact_match", allowGetters = true)
public record HeaderMatchResult(
    @JsonProperty("expected") List<String> expected,
    @JsonProperty("actual") List<String> actual,
    @JsonProperty("matched") List<String> matched,
    @JsonProperty("missing") List<String> missing,
    @JsonProperty("unexpected") List<String> unexpected,
    @JsonProperty("case_mismatches") List<CaseMismatch> caseMismatches
) implements Serializable {

    public HeaderMatchResult {
        expected = List.copyOf(expected);
        actual = List.copyOf(actual);
        matched = List.copyOf(matched);
        missing = List.copyOf(missing);
        unexpected = List.copyOf(unexpected);
        caseMismatches = List.copyOf(caseMismatches);
    }

    @JsonProperty("exact_match")
    public boolean isExactMatch() {
        return missing.isEmpty() && unexpected.isEmpty();
    }

    public record CaseMismatch(
        @JsonProperty("expected") String expected,
        @JsonProperty("actual") String actual
    ) implements Serializable {}
}

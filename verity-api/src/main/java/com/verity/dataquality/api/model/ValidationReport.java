/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Everything a single validation run produced for one dataset.
 *
 * <p>The report is self-contained: it references no engine state and a
 * re-run on the same inputs produces an equal report. It is the hand-off
 * structure for report renderers.
 */
public record ValidationReport(
    @JsonProperty("outcomes") List<ValidationOutcome> outcomes,
    @JsonProperty("duplicates") List<DuplicateEntry> duplicates,
    @JsonProperty("formatting_issues") List<FormattingIssue> formattingIssues,
    @JsonProperty("header_match") HeaderMatchResult headerMatch,
    @JsonProperty("summary") ValidationSummary summary
) implements Serializable {

    public ValidationReport {
        outcomes = List.copyOf(outcomes);
        duplicates = List.copyOf(duplicates);
        formattingIssues = List.copyOf(formattingIssues);
    }

    /**
     * Outcomes with at least one error, in row order.
     */
    public List<ValidationOutcome> invalidOutcomes() {
        return outcomes.stream().filter(o -> !o.isValid()).toList();
    }
}

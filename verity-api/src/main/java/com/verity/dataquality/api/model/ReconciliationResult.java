/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of matching a source dataset against a destination dataset.
 *
 * <h2>Usage</h2>
 * <pre>
 * ReconciliationResult result = engine.reconcile(source, destination, List.of("ID"), true);
 * if (!result.isPerfectMatch()) {
 *     result.missing().forEach(m -&gt; System.out.println("missing " + m.compositeKey()));
 * }
 * </pre>
 */
public record ReconciliationResult(
    @JsonProperty("missing") List<MatchEntry> missing,
    @JsonProperty("extra") List<MatchEntry> extra,
    @JsonProperty("mismatches") List<MismatchEntry> mismatches,
    @JsonProperty("summary") ReconciliationSummary summary
) implements Serializable {

    public ReconciliationResult {
        missing = List.copyOf(missing);
        extra = List.copyOf(extra);
        mismatches = List.copyOf(mismatches);
    }

    @JsonIgnore
    public boolean isPerfectMatch() {
        return summary.status() == ReconciliationStatus.PERFECT_MATCH;
    }
}

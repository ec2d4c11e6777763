package com.verity.dataquality.runtime.operators;

import java.util.List;

/**
 * Outcome of a decimal check. {@code detail} is a human-readable description of
 * every violation, joined with {@code "; "}, and empty when the value is valid.
 */
public record DecimalCheckResult(List<DecimalViolation> violations, String detail) {

    private static final DecimalCheckResult VALID = new DecimalCheckResult(List.of(), "");

    public DecimalCheckResult {
        violations = List.copyOf(violations);
        detail = detail == null ? "" : detail;
    }

    public static DecimalCheckResult valid() {
        return VALID;
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public boolean has(DecimalViolation violation) {
        return violations.contains(violation);
    }
}

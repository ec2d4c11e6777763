/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.runtime.operators;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks a decimal literal against a declared precision and scale.
 *
 * <p>The arithmetic works on the digits as written, never on a binary floating
 * point value, so {@code "0.10"} has two fractional digits and large values do
 * not lose digits to rounding. One leading sign is ignored for digit counting.
 *
 * <p>With a decimal point, all three digit checks run and every violated one is
 * reported: a value can exceed the total precision and the integer allotment at
 * the same time, and remediation text depends on knowing both.
 */
public final class DecimalPrecisionChecker {

    private DecimalPrecisionChecker() {
    }

    public static DecimalCheckResult check(String value, String typeSpec) {
        return check(value, DecimalSpec.parse(typeSpec));
    }

    public static DecimalCheckResult check(String value, Optional<DecimalSpec> spec) {
        String trimmed = value == null ? "" : value.trim();
        if (!isNumeric(trimmed)) {
            return new DecimalCheckResult(List.of(DecimalViolation.NOT_NUMERIC), "not a valid number");
        }
        if (spec.isEmpty()) {
            return DecimalCheckResult.valid();
        }
        if (trimmed.indexOf('e') >= 0 || trimmed.indexOf('E') >= 0) {
            return new DecimalCheckResult(List.of(DecimalViolation.NOT_NUMERIC), "not a plain decimal literal");
        }

        DecimalSpec decimal = spec.get();
        String digits = stripSign(trimmed);
        int point = digits.indexOf('.');

        if (point < 0) {
            if (digits.length() > decimal.precision()) {
                return new DecimalCheckResult(List.of(DecimalViolation.PRECISION_EXCEEDED),
                    digits.length() + " digits exceed precision " + decimal.precision());
            }
            return DecimalCheckResult.valid();
        }

        int integerDigits = point;
        int fractionalDigits = digits.length() - point - 1;

        List<DecimalViolation> violations = new ArrayList<>(3);
        List<String> details = new ArrayList<>(3);
        if (fractionalDigits != decimal.scale()) {
            violations.add(DecimalViolation.SCALE_MISMATCH);
            details.add("expected " + decimal.scale() + " decimal places, got " + fractionalDigits);
        }
        if (integerDigits + fractionalDigits > decimal.precision()) {
            violations.add(DecimalViolation.PRECISION_EXCEEDED);
            details.add((integerDigits + fractionalDigits) + " digits exceed precision " + decimal.precision());
        }
        if (integerDigits > decimal.integerDigits()) {
            violations.add(DecimalViolation.INTEGER_DIGITS_EXCEEDED);
            details.add("integer part has " + integerDigits + " digits, at most "
                + decimal.integerDigits() + " allowed");
        }
        return violations.isEmpty()
            ? DecimalCheckResult.valid()
            : new DecimalCheckResult(violations, String.join("; ", details));
    }

    /**
     * True iff {@code value} is a real number in {@link BigDecimal} syntax.
     */
    public static boolean isNumeric(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        try {
            new BigDecimal(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * True iff {@code value} is numeric and written without an exponent.
     */
    public static boolean isPlainDecimal(String value) {
        return isNumeric(value) && value.indexOf('e') < 0 && value.indexOf('E') < 0;
    }

    static String stripSign(String value) {
        if (!value.isEmpty() && (value.charAt(0) == '-' || value.charAt(0) == '+')) {
            return value.substring(1);
        }
        return value;
    }
}

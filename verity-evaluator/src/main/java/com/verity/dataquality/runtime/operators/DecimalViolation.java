package com.verity.dataquality.runtime.operators;

/**
 * Sub-checks of the decimal precision algorithm, in evaluation order.
 */
public enum DecimalViolation {
    NOT_NUMERIC,
    SCALE_MISMATCH,
    PRECISION_EXCEEDED,
    INTEGER_DIGITS_EXCEEDED
}

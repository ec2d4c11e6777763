package com.verity.dataquality.api.exceptions;

/**
 * Exception thrown when a rule definition source cannot be turned into a rule set.
 *
 * This is a RuntimeException, like other loader failures, so callers are not
 * forced into checked exception handling. Individual malformed rows do not raise
 * it; they are skipped and reported on the resulting rule set.
 */
public class RuleSetLoadException extends RuntimeException {

    public RuleSetLoadException(String message) {
        super(message);
    }

    public RuleSetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

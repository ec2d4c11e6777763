package com.verity.dataquality.api.exceptions;

/**
 * Thrown when the engine is invoked incorrectly, e.g. validating with an empty
 * rule set or reconciling before both datasets have been loaded.
 *
 * <p>This signals caller misuse, not bad data: constraint violations found in
 * records are always reported as result entries and never thrown.
 */
public class PreconditionViolationException extends IllegalStateException {

    public PreconditionViolationException(String message) {
        super(message);
    }
}

package com.visaeligibility.exception;

/**
 * Raised when a single requirement's expression cannot be evaluated,
 * e.g. an ordering comparison between a number and a boolean.
 * Scoped to that requirement; never aborts the rest of the rule version.
 */
public class EvaluationError extends EligibilityException {

    public EvaluationError(String message) {
        super(message);
    }
}

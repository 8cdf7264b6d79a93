package com.visaeligibility.expression;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of evaluating one expression. {@code value} is {@code null} when the
 * expression is indeterminate because a referenced fact is absent; the absent
 * fact keys are in {@code missingVariables}.
 */
public record EvaluationResult(Boolean value, Set<String> missingVariables) {

    public EvaluationResult {
        missingVariables = Collections.unmodifiableSet(new TreeSet<>(missingVariables));
    }

    public boolean isDeterminate() {
        return value != null;
    }

    public boolean isTrue() {
        return Boolean.TRUE.equals(value);
    }

    public boolean hasMissingVariables() {
        return !missingVariables.isEmpty();
    }
}

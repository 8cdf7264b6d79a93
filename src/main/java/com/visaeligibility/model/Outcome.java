package com.visaeligibility.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Outcome {

    ELIGIBLE("eligible"),
    NOT_ELIGIBLE("not_eligible"),
    REQUIRES_REVIEW("requires_review");

    private final String value;

    Outcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup used when reading model output. Accepts the canonical
     * values with spaces or hyphens, plus the likely/possible/unlikely scale.
     * Anything else is unknown.
     */
    public static Optional<Outcome> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim()
                .toLowerCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');

        return switch (normalized) {
            case "eligible", "likely" -> Optional.of(ELIGIBLE);
            case "not_eligible", "ineligible", "unlikely" -> Optional.of(NOT_ELIGIBLE);
            case "requires_review", "possible", "review" -> Optional.of(REQUIRES_REVIEW);
            default -> Optional.empty();
        };
    }
}

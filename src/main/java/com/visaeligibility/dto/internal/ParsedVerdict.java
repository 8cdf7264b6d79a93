package com.visaeligibility.dto.internal;

import com.visaeligibility.model.Outcome;

/**
 * Verdict fields read from model text; either may be null (unknown).
 */
public record ParsedVerdict(Outcome outcome, Double confidence) {

    public static ParsedVerdict unknown() {
        return new ParsedVerdict(null, null);
    }

    public boolean isComplete() {
        return outcome != null && confidence != null;
    }
}

package com.visaeligibility.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record RuleVersion(
        String id,
        String visaTypeId,
        LocalDate effectiveFrom,
        LocalDate effectiveTo,
        boolean published,
        Instant createdAt,
        List<Requirement> requirements
) {

    public RuleVersion {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }

    /**
     * Published, and the date falls inside [effectiveFrom, effectiveTo]. An open
     * effectiveTo means the version has no end date.
     */
    public boolean isActiveOn(LocalDate date) {
        if (!published || effectiveFrom == null) {
            return false;
        }
        return !effectiveFrom.isAfter(date)
                && (effectiveTo == null || !effectiveTo.isBefore(date));
    }
}

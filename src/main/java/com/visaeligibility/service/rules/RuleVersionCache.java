package com.visaeligibility.service.rules;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Rule version lookups memoized for a single coordinator run, keyed by
 * (visa type, date). A new cache is created per run and dropped with it, so a
 * rule version published mid-flight is seen by the next run.
 */
public class RuleVersionCache {

    private final Map<Key, RuleVersionSelection> selections = new HashMap<>();

    public RuleVersionSelection get(String visaTypeId, LocalDate asOf, Supplier<RuleVersionSelection> loader) {
        return selections.computeIfAbsent(new Key(visaTypeId, asOf), key -> loader.get());
    }

    public int size() {
        return selections.size();
    }

    private record Key(String visaTypeId, LocalDate asOf) {
    }
}

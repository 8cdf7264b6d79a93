package com.visaeligibility.service.store.memory;

import com.visaeligibility.model.Fact;
import com.visaeligibility.model.FactValue;
import com.visaeligibility.service.store.CaseFactsProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fact snapshots per case, keyed by fact key. The last fact with a given key wins.
 */
@Slf4j
@Component
public class InMemoryCaseFactsStore implements CaseFactsProvider {

    private final Map<String, Map<String, Fact>> factsByCase = new ConcurrentHashMap<>();

    @Override
    public Map<String, FactValue> getFacts(String caseId) {
        Map<String, Fact> facts = factsByCase.get(caseId);
        if (facts == null) {
            return Map.of();
        }
        Map<String, FactValue> values = new LinkedHashMap<>();
        facts.forEach((key, fact) -> values.put(key, fact.value()));
        return Collections.unmodifiableMap(values);
    }

    public Optional<Fact> findFact(String caseId, String key) {
        return Optional.ofNullable(factsByCase.getOrDefault(caseId, Map.of()).get(key));
    }

    public void putFacts(String caseId, Collection<Fact> facts) {
        Map<String, Fact> byKey = new LinkedHashMap<>();
        for (Fact fact : facts) {
            if (!caseId.equals(fact.caseId())) {
                throw new IllegalArgumentException("Fact " + fact.key() + " belongs to case " + fact.caseId()
                        + ", not " + caseId);
            }
            byKey.put(fact.key(), fact);
        }
        factsByCase.put(caseId, byKey);
        log.debug("Stored {} facts for case {}", byKey.size(), caseId);
    }

    /**
     * Stores values without a recorded source.
     */
    public void putFacts(String caseId, Map<String, FactValue> facts) {
        putFacts(caseId, facts.entrySet().stream()
                .map(e -> new Fact(caseId, e.getKey(), e.getValue(), null))
                .toList());
    }

    public void clear() {
        factsByCase.clear();
    }

    public int getCaseCount() {
        return factsByCase.size();
    }
}

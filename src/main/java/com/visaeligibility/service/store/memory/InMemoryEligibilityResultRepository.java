package com.visaeligibility.service.store.memory;

import com.visaeligibility.exception.PersistenceException;
import com.visaeligibility.model.EligibilityResult;
import com.visaeligibility.service.store.EligibilityResultRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Repository
public class InMemoryEligibilityResultRepository implements EligibilityResultRepository {

    private final Map<String, EligibilityResult> results = new ConcurrentHashMap<>();

    @Override
    public EligibilityResult save(EligibilityResult result) {
        if (result.getCaseId() == null || result.getOutcome() == null) {
            throw new PersistenceException("Eligibility result requires a case id and an outcome");
        }
        EligibilityResult stored = result.getId() != null
                ? result
                : result.toBuilder().id(UUID.randomUUID().toString()).build();

        // results are written once and never updated
        if (results.putIfAbsent(stored.getId(), stored) != null) {
            throw new PersistenceException("Eligibility result " + stored.getId() + " already exists");
        }
        log.debug("Stored eligibility result {} for case {}", stored.getId(), stored.getCaseId());
        return stored;
    }

    @Override
    public Optional<EligibilityResult> findById(String id) {
        return Optional.ofNullable(results.get(id));
    }

    @Override
    public List<EligibilityResult> findByCaseId(String caseId) {
        return results.values().stream()
                .filter(r -> r.getCaseId().equals(caseId))
                .sorted(Comparator.comparing(EligibilityResult::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }
}

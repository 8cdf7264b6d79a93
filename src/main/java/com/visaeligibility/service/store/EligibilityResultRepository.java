package com.visaeligibility.service.store;

import com.visaeligibility.model.EligibilityResult;

import java.util.List;
import java.util.Optional;

public interface EligibilityResultRepository {

    /**
     * Stores a new result and returns it with its assigned id.
     *
     * @throws com.visaeligibility.exception.PersistenceException if the write fails
     */
    EligibilityResult save(EligibilityResult result);

    Optional<EligibilityResult> findById(String id);

    List<EligibilityResult> findByCaseId(String caseId);
}

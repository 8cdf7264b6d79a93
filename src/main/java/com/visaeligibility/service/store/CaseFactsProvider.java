package com.visaeligibility.service.store;

import com.visaeligibility.model.FactValue;

import java.util.Map;

/**
 * Read access to the fact snapshot of a case. Facts are owned by the case
 * service; the engine never writes them.
 */
public interface CaseFactsProvider {

    /**
     * @return fact key to value; empty when the case has no facts
     */
    Map<String, FactValue> getFacts(String caseId);
}

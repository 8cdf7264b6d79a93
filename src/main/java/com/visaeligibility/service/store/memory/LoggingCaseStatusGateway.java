package com.visaeligibility.service.store.memory;

import com.visaeligibility.service.store.CaseStatusGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class LoggingCaseStatusGateway implements CaseStatusGateway {

    private final Set<String> evaluatedCases = ConcurrentHashMap.newKeySet();

    @Override
    public void markCaseEvaluated(String caseId) {
        evaluatedCases.add(caseId);
        log.info("Case {} marked as evaluated", caseId);
    }

    public boolean isEvaluated(String caseId) {
        return evaluatedCases.contains(caseId);
    }
}

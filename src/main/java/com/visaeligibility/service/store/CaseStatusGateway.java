package com.visaeligibility.service.store;

public interface CaseStatusGateway {

    void markCaseEvaluated(String caseId);
}

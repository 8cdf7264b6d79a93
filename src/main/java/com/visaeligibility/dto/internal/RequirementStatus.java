package com.visaeligibility.dto.internal;

public enum RequirementStatus {
    PASSED,
    FAILED,
    MISSING_FACTS,
    ERROR;

    public boolean isEvaluable() {
        return this == PASSED || this == FAILED;
    }
}

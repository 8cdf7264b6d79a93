package com.visaeligibility.exception;

import lombok.Getter;

/**
 * The single check-level failure raised by the coordinator. A check either
 * returns a complete result or raises this; partial results are never returned.
 */
@Getter
public class EligibilityCheckException extends EligibilityException {

    private final String caseId;
    private final String visaTypeId;

    public EligibilityCheckException(String caseId, String visaTypeId, String message, Throwable cause) {
        super(message, cause);
        this.caseId = caseId;
        this.visaTypeId = visaTypeId;
    }

    public boolean isNotFound() {
        return getCause() instanceof RuleVersionNotFoundException
                || getCause() instanceof VisaTypeNotFoundException;
    }
}

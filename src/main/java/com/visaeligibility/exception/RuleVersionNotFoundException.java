package com.visaeligibility.exception;

import java.time.LocalDate;

public class RuleVersionNotFoundException extends EligibilityException {

    public RuleVersionNotFoundException(String visaTypeId, LocalDate asOf) {
        super("No active rule version for visa type " + visaTypeId + " on " + asOf);
    }
}

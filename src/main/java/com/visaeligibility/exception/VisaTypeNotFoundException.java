package com.visaeligibility.exception;

public class VisaTypeNotFoundException extends EligibilityException {

    public VisaTypeNotFoundException(String visaTypeId) {
        super("Visa type " + visaTypeId + " not found");
    }
}

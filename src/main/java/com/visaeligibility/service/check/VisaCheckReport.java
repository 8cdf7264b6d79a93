package com.visaeligibility.service.check;

/**
 * Per-visa entry of a multi-visa check: either an outcome or the error that
 * failed the run.
 */
public record VisaCheckReport(
        String visaTypeId,
        EligibilityCheckOutcome outcome,
        String error,
        boolean notFound
) {

    public static VisaCheckReport success(String visaTypeId, EligibilityCheckOutcome outcome) {
        return new VisaCheckReport(visaTypeId, outcome, null, false);
    }

    public static VisaCheckReport failure(String visaTypeId, String error, boolean notFound) {
        return new VisaCheckReport(visaTypeId, null, error, notFound);
    }

    public boolean isSuccess() {
        return outcome != null;
    }
}

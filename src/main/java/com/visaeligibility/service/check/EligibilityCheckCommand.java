package com.visaeligibility.service.check;

import java.time.LocalDate;

/**
 * @param evaluationDate     date the rule version must be active on; today when null
 * @param enableAiReasoning  false skips AI reasoning for this check; null follows configuration
 */
public record EligibilityCheckCommand(
        String caseId,
        String visaTypeId,
        LocalDate evaluationDate,
        Boolean enableAiReasoning
) {

    public static EligibilityCheckCommand of(String caseId, String visaTypeId) {
        return new EligibilityCheckCommand(caseId, visaTypeId, null, null);
    }
}

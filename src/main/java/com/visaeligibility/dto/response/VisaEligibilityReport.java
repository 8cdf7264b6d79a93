package com.visaeligibility.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.visaeligibility.model.Citation;
import com.visaeligibility.model.Outcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VisaEligibilityReport {

    // ================= RUN =================
    private String visaTypeId;

    /**
     * completed or failed
     */
    private String status;

    private String error;

    // ================= VERDICT =================
    private String resultId;

    private String ruleVersionId;

    private Outcome outcome;

    private Double confidence;

    private String reasoningSummary;

    private List<String> missingFacts;

    private Boolean conflict;

    private Boolean escalated;

    private String escalationReason;

    // ================= AI =================
    /**
     * COMPLETED, UNAVAILABLE or DISABLED
     */
    private String aiStatus;

    private String reasoningLogId;

    private List<Citation> citations;

    private List<String> warnings;
}

package com.visaeligibility.dto.internal;

import com.visaeligibility.model.Outcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CombinedVerdict {

    public enum Source {
        RULE,
        AI
    }

    public static final String REASON_CONFLICT = "rule_ai_conflict";
    public static final String REASON_LOW_CONFIDENCE = "low_confidence";
    public static final String REASON_MISSING_MANDATORY = "missing_mandatory_facts";

    private Outcome outcome;

    private double confidence;

    private boolean conflict;

    private String conflictReason;

    private boolean escalate;

    // first applicable of REASON_CONFLICT, REASON_LOW_CONFIDENCE, REASON_MISSING_MANDATORY
    private String escalationReason;

    private Source source;

    private String reasoningSummary;
}

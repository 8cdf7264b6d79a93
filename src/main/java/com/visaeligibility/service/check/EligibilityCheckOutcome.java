package com.visaeligibility.service.check;

import com.visaeligibility.dto.internal.CombinedVerdict;
import com.visaeligibility.dto.internal.ReasoningResult;
import com.visaeligibility.dto.internal.RuleEvaluationResult;
import com.visaeligibility.model.Citation;
import com.visaeligibility.model.EligibilityResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Complete result of one check run. {@code reasoning} and
 * {@code reasoningLogId} are null unless the AI path ran.
 */
@Value
@Builder
public class EligibilityCheckOutcome {

    public enum AiStatus {
        COMPLETED,
        UNAVAILABLE,
        DISABLED
    }

    EligibilityResult result;

    RuleEvaluationResult ruleEvaluation;

    ReasoningResult reasoning;

    CombinedVerdict verdict;

    AiStatus aiStatus;

    boolean escalated;

    String reasoningLogId;

    @Builder.Default
    List<Citation> citations = List.of();

    @Builder.Default
    List<CheckState> states = List.of();

    @Builder.Default
    List<String> warnings = List.of();

    public boolean isAiUnavailable() {
        return aiStatus == AiStatus.UNAVAILABLE;
    }
}

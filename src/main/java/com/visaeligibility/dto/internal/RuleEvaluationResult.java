package com.visaeligibility.dto.internal;

import com.visaeligibility.model.Outcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregate of one rule version evaluated against a case's facts.
 * {@code missingFacts} lists the codes of requirements that could not be
 * evaluated for lack of facts; {@code missingFactKeys} the absent fact keys.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleEvaluationResult {

    private String ruleVersionId;

    private Outcome outcome;

    private double confidence;

    private int passed;

    private int failed;

    private int totalEvaluable;

    private int total;

    @Builder.Default
    private List<String> missingFacts = List.of();

    @Builder.Default
    private List<String> missingFactKeys = List.of();

    @Builder.Default
    private List<String> missingMandatoryFacts = List.of();

    @Builder.Default
    private List<String> errors = List.of();

    @Builder.Default
    private boolean mandatoryFailed = false;

    @Builder.Default
    private List<RequirementResult> requirementResults = List.of();

    /**
     * Mandatory requirements whose status could not be determined, either for
     * lack of facts or because evaluation raised an error.
     */
    public List<String> getUnresolvedMandatory() {
        return requirementResults.stream()
                .filter(RequirementResult::isMandatory)
                .filter(r -> !r.getStatus().isEvaluable())
                .map(RequirementResult::getCode)
                .toList();
    }

    public boolean hasUnresolvedMandatory() {
        return !getUnresolvedMandatory().isEmpty() || !missingMandatoryFacts.isEmpty();
    }
}

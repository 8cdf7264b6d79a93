package com.visaeligibility.service.rules;

import com.visaeligibility.config.EligibilityProperties;
import com.visaeligibility.dto.internal.RequirementResult;
import com.visaeligibility.dto.internal.RequirementStatus;
import com.visaeligibility.dto.internal.RuleEvaluationResult;
import com.visaeligibility.exception.EvaluationError;
import com.visaeligibility.exception.RuleVersionNotFoundException;
import com.visaeligibility.expression.EvaluationResult;
import com.visaeligibility.expression.ExpressionEvaluator;
import com.visaeligibility.model.FactValue;
import com.visaeligibility.model.Outcome;
import com.visaeligibility.model.Requirement;
import com.visaeligibility.model.RuleVersion;
import com.visaeligibility.service.store.RuleVersionProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic evaluation of a visa type's active rule version.
 *
 * <p>Confidence is {@code passed / evaluable}, where requirements that could
 * not be evaluated (missing facts or an {@link EvaluationError}) are left out of
 * the denominator; with nothing evaluable the confidence is 0. A failed
 * mandatory requirement makes the outcome {@code not_eligible} whatever the
 * confidence.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleEvaluationEngine {

    private static final Comparator<RuleVersion> MOST_RECENTLY_CREATED = Comparator
            .comparing(RuleVersion::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(RuleVersion::id, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    private final RuleVersionProvider ruleVersionProvider;
    private final ExpressionEvaluator expressionEvaluator;
    private final EligibilityProperties properties;

    /**
     * Resolves the rule version active for the visa type on {@code asOf}. When
     * several are active the most recently created wins and the overlap is logged.
     *
     * @throws RuleVersionNotFoundException when no version is active
     */
    public RuleVersionSelection loadActiveRuleVersion(String visaTypeId, LocalDate asOf, RuleVersionCache cache) {
        return cache.get(visaTypeId, asOf, () -> selectActiveRuleVersion(visaTypeId, asOf));
    }

    private RuleVersionSelection selectActiveRuleVersion(String visaTypeId, LocalDate asOf) {
        List<RuleVersion> candidates = ruleVersionProvider.findActiveRuleVersions(visaTypeId, asOf).stream()
                .filter(v -> v.isActiveOn(asOf))
                .sorted(MOST_RECENTLY_CREATED.reversed())
                .toList();

        if (candidates.isEmpty()) {
            log.error("No active rule version for visa type {} on {}", visaTypeId, asOf);
            throw new RuleVersionNotFoundException(visaTypeId, asOf);
        }

        RuleVersion selected = candidates.get(0);
        List<String> ids = candidates.stream().map(RuleVersion::id).toList();

        if (candidates.size() > 1) {
            log.warn("Ambiguous rule versions for visa type {} on {}: {} are all active, using {} (most recently created)",
                    visaTypeId, asOf, ids, selected.id());
        } else {
            log.debug("Using rule version {} for visa type {} on {}", selected.id(), visaTypeId, asOf);
        }
        return new RuleVersionSelection(selected, ids);
    }

    public RuleEvaluationResult evaluate(RuleVersion ruleVersion, Map<String, FactValue> facts) {
        return aggregate(ruleVersion, evaluateAll(ruleVersion, facts));
    }

    public List<RequirementResult> evaluateAll(RuleVersion ruleVersion, Map<String, FactValue> facts) {
        List<RequirementResult> results = new ArrayList<>(ruleVersion.requirements().size());
        for (Requirement requirement : ruleVersion.requirements()) {
            results.add(evaluateRequirement(requirement, facts));
        }
        return results;
    }

    private RequirementResult evaluateRequirement(Requirement requirement, Map<String, FactValue> facts) {
        RequirementResult.RequirementResultBuilder result = RequirementResult.builder()
                .code(requirement.code())
                .description(requirement.description())
                .mandatory(requirement.mandatory());

        if (requirement.expression() == null) {
            log.warn("Requirement {} has no expression", requirement.code());
            return result.status(RequirementStatus.ERROR)
                    .errorMessage("Requirement has no expression")
                    .build();
        }

        try {
            EvaluationResult evaluation = expressionEvaluator.evaluate(requirement.expression(), facts);

            // any absent fact makes the requirement unevaluable, even if the tree short-circuits
            if (evaluation.hasMissingVariables()) {
                return result.status(RequirementStatus.MISSING_FACTS)
                        .missingVariables(List.copyOf(evaluation.missingVariables()))
                        .build();
            }
            return result.status(evaluation.isTrue() ? RequirementStatus.PASSED : RequirementStatus.FAILED)
                    .build();

        } catch (EvaluationError e) {
            log.warn("Requirement {} could not be evaluated: {}", requirement.code(), e.getMessage());
            return result.status(RequirementStatus.ERROR)
                    .errorMessage(e.getMessage())
                    .build();
        }
    }

    public RuleEvaluationResult aggregate(RuleVersion ruleVersion, List<RequirementResult> results) {
        int passed = 0;
        int failed = 0;
        boolean mandatoryFailed = false;
        List<String> missingFacts = new ArrayList<>();
        List<String> missingMandatory = new ArrayList<>();
        Set<String> missingKeys = new LinkedHashSet<>();
        List<String> errors = new ArrayList<>();

        for (RequirementResult result : results) {
            switch (result.getStatus()) {
                case PASSED -> passed++;
                case FAILED -> {
                    failed++;
                    mandatoryFailed |= result.isMandatory();
                }
                case MISSING_FACTS -> {
                    missingFacts.add(result.getCode());
                    missingKeys.addAll(result.getMissingVariables());
                    if (result.isMandatory()) {
                        missingMandatory.add(result.getCode());
                    }
                }
                case ERROR -> errors.add(result.getCode());
            }
        }

        int totalEvaluable = passed + failed;
        double confidence = totalEvaluable == 0 ? 0.0 : (double) passed / totalEvaluable;
        boolean unresolvedMandatory = results.stream()
                .anyMatch(r -> r.isMandatory() && !r.getStatus().isEvaluable());

        Outcome outcome;
        if (mandatoryFailed) {
            outcome = Outcome.NOT_ELIGIBLE;
        } else if (confidence >= properties.getEligibleThreshold() && !unresolvedMandatory) {
            outcome = Outcome.ELIGIBLE;
        } else if (confidence >= properties.getPossibleThreshold()) {
            outcome = Outcome.REQUIRES_REVIEW;
        } else {
            outcome = Outcome.NOT_ELIGIBLE;
        }

        log.debug("Rule version {}: {}/{} evaluable passed, {} missing, {} errors -> {} ({})",
                ruleVersion.id(), passed, totalEvaluable, missingFacts.size(), errors.size(),
                outcome.getValue(), String.format("%.2f", confidence));

        return RuleEvaluationResult.builder()
                .ruleVersionId(ruleVersion.id())
                .outcome(outcome)
                .confidence(confidence)
                .passed(passed)
                .failed(failed)
                .totalEvaluable(totalEvaluable)
                .total(results.size())
                .missingFacts(List.copyOf(missingFacts))
                .missingFactKeys(List.copyOf(missingKeys))
                .missingMandatoryFacts(List.copyOf(missingMandatory))
                .errors(List.copyOf(errors))
                .mandatoryFailed(mandatoryFailed)
                .requirementResults(List.copyOf(results))
                .build();
    }
}

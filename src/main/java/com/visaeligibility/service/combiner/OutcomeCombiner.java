package com.visaeligibility.service.combiner;

import com.visaeligibility.config.EligibilityProperties;
import com.visaeligibility.dto.internal.CombinedVerdict;
import com.visaeligibility.dto.internal.ReasoningResult;
import com.visaeligibility.dto.internal.RuleEvaluationResult;
import com.visaeligibility.model.Outcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Merges the rule verdict with the AI verdict, when there is one.
 *
 * <p>Opposite verdicts (eligible against not_eligible) resolve to
 * {@code requires_review} with the lower of the two confidences, even when the
 * AI stated no confidence. Otherwise the AI verdict is taken as is when both
 * its outcome and confidence were read. Escalation is decided here but carried out by the
 * caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutcomeCombiner {

    private final EligibilityProperties properties;

    /**
     * @param ai reasoning output, or null when AI reasoning did not run
     */
    public CombinedVerdict combine(RuleEvaluationResult rule, ReasoningResult ai) {
        CombinedVerdict.CombinedVerdictBuilder verdict = CombinedVerdict.builder();

        Outcome outcome;
        double confidence;
        boolean conflict = false;
        String summary;

        if (hasOutcome(ai) && isConflict(rule.getOutcome(), ai.getOutcome())) {
            conflict = true;
            outcome = Outcome.REQUIRES_REVIEW;
            // an unread AI confidence leaves the rule confidence as the bound
            confidence = ai.getConfidence() == null
                    ? rule.getConfidence()
                    : Math.min(rule.getConfidence(), ai.getConfidence());
            verdict.conflictReason(String.format("Rule engine outcome (%s) conflicts with AI outcome (%s)",
                    rule.getOutcome().getValue(), ai.getOutcome().getValue()));
            summary = String.format(
                    "Rule engine evaluation indicates %s, while AI reasoning suggests %s. "
                            + "Human review recommended for accurate assessment.",
                    rule.getOutcome().getValue(), ai.getOutcome().getValue());
            verdict.source(CombinedVerdict.Source.AI);
        } else if (ai != null && ai.hasVerdict()) {
            outcome = ai.getOutcome();
            confidence = ai.getConfidence();
            summary = truncate(ai.getResponseText(), properties.getSummaryMaxChars());
            verdict.source(CombinedVerdict.Source.AI);
        } else {
            outcome = rule.getOutcome();
            confidence = rule.getConfidence();
            summary = ruleSummary(rule);
            verdict.source(CombinedVerdict.Source.RULE);
        }

        String escalationReason = null;
        double threshold = properties.getEscalationThreshold();

        if (conflict) {
            escalationReason = CombinedVerdict.REASON_CONFLICT;
        }
        if (confidence < threshold) {
            if (escalationReason == null) {
                escalationReason = CombinedVerdict.REASON_LOW_CONFIDENCE;
            }
            summary = String.format(Locale.ROOT,
                    "%s Confidence is below threshold (%.0f%% < %.0f%%). Human review recommended.",
                    summary, confidence * 100, threshold * 100).trim();
        }
        if (rule.hasUnresolvedMandatory() && escalationReason == null) {
            escalationReason = CombinedVerdict.REASON_MISSING_MANDATORY;
        }

        CombinedVerdict result = verdict
                .outcome(outcome)
                .confidence(clamp(confidence))
                .conflict(conflict)
                .escalate(escalationReason != null)
                .escalationReason(escalationReason)
                .reasoningSummary(summary)
                .build();

        log.debug("Combined verdict: {} ({}) from {}, conflict={}, escalate={}",
                outcome.getValue(), String.format(Locale.ROOT, "%.2f", result.getConfidence()),
                result.getSource(), conflict, escalationReason);
        return result;
    }

    /**
     * True only for opposite ends; {@code requires_review} on either side never conflicts.
     */
    public static boolean isConflict(Outcome rule, Outcome ai) {
        return (rule == Outcome.ELIGIBLE && ai == Outcome.NOT_ELIGIBLE)
                || (rule == Outcome.NOT_ELIGIBLE && ai == Outcome.ELIGIBLE);
    }

    private static boolean hasOutcome(ReasoningResult ai) {
        return ai != null && ai.isCompleted() && ai.getOutcome() != null;
    }

    private static String ruleSummary(RuleEvaluationResult rule) {
        return String.format(Locale.ROOT,
                "Rule engine evaluation: %d of %d requirements passed. Confidence: %.0f%%.",
                rule.getPassed(), rule.getTotal(), rule.getConfidence() * 100);
    }

    private static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.length() <= maxChars ? trimmed : trimmed.substring(0, maxChars);
    }

    private static double clamp(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}

package com.visaeligibility.util;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import com.visaeligibility.dto.internal.RequirementResult;
import com.visaeligibility.dto.internal.RuleEvaluationResult;
import com.visaeligibility.dto.internal.ScoredChunk;
import com.visaeligibility.model.FactValue;
import com.visaeligibility.model.VisaType;

/**
 * Builds the eligibility reasoning prompt. Output depends only on the inputs:
 * facts are serialized in key order, requirements in rule version order and
 * context chunks in ranking order, so a stored prompt can be reproduced.
 */
@Component
public class PromptBuilder {

    /* =========================================================
     * SYSTEM PROMPT
     * ========================================================= */
    public String buildSystemPrompt() {
        return """
                You are an immigration eligibility analyst.

                Rules:
                1. Base your assessment only on the case facts, the rule evaluation and the reference material provided
                2. Cite the reference passages you rely on by their number, e.g. [1]
                3. If the material is insufficient, say so and lower your confidence
                4. Never invent facts about the applicant

                Answer in English.
                """;
    }

    /* =========================================================
     * ELIGIBILITY PROMPT
     * ========================================================= */
    public String buildEligibilityPrompt(
            VisaType visaType,
            Map<String, FactValue> facts,
            RuleEvaluationResult ruleResult,
            List<ScoredChunk> context) {

        StringBuilder prompt = new StringBuilder();

        prompt.append("### TASK\n");
        prompt.append("Assess whether the applicant is eligible for the visa below.\n\n");

        prompt.append("### VISA\n");
        prompt.append(visaType.code());
        if (visaType.name() != null) {
            prompt.append(" - ").append(visaType.name());
        }
        if (visaType.jurisdiction() != null) {
            prompt.append(" (").append(visaType.jurisdiction()).append(")");
        }
        prompt.append("\n\n");

        prompt.append("### CASE FACTS\n");
        if (facts == null || facts.isEmpty()) {
            prompt.append("(none)\n");
        } else {
            new TreeMap<>(facts).forEach((key, value) ->
                    prompt.append("- ").append(key).append(": ").append(value.asText()).append("\n"));
        }
        prompt.append("\n");

        prompt.append("### RULE EVALUATION\n");
        prompt.append(formatRuleResult(ruleResult));
        prompt.append("\n");

        prompt.append("### REFERENCE MATERIAL\n");
        prompt.append(formatContext(context));
        prompt.append("\n");

        prompt.append("### ANSWER FORMAT\n");
        prompt.append("Explain your reasoning briefly, then end with a JSON block:\n");
        prompt.append("{\"outcome\": \"eligible|not_eligible|requires_review\", \"confidence\": 0.0-1.0, \"citations\": [1, 2]}\n");
        prompt.append("followed by the two lines\n");
        prompt.append("OUTCOME: <eligible|not_eligible|requires_review>\n");
        prompt.append("CONFIDENCE: <0.0-1.0>\n\n");

        prompt.append("### ANSWER");

        return prompt.toString();
    }

    /**
     * System and user prompt as stored in the reasoning log.
     */
    public String combine(String systemPrompt, String userPrompt) {
        return "[SYSTEM]\n" + systemPrompt + "\n[USER]\n" + userPrompt;
    }

    private String formatRuleResult(RuleEvaluationResult ruleResult) {
        StringBuilder sb = new StringBuilder();
        sb.append("Preliminary outcome: ").append(ruleResult.getOutcome().getValue())
                .append(" (confidence ").append(String.format(Locale.ROOT, "%.2f", ruleResult.getConfidence()))
                .append(", ").append(ruleResult.getPassed()).append(" of ")
                .append(ruleResult.getTotalEvaluable()).append(" evaluable requirements passed)\n");

        for (RequirementResult requirement : ruleResult.getRequirementResults()) {
            sb.append("- ").append(requirement.getCode());
            sb.append(requirement.isMandatory() ? " [mandatory]" : " [optional]");
            sb.append(": ").append(requirement.getStatus().name());
            if (!requirement.getMissingVariables().isEmpty()) {
                sb.append(" (missing: ").append(String.join(", ", requirement.getMissingVariables())).append(")");
            }
            if (requirement.getDescription() != null) {
                sb.append(" - ").append(requirement.getDescription());
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    private String formatContext(List<ScoredChunk> context) {
        if (context == null || context.isEmpty()) {
            return "(no reference material found)\n";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < context.size(); i++) {
            ScoredChunk chunk = context.get(i);
            sb.append("[").append(i + 1).append("] ")
                    .append("(document ").append(chunk.getDocumentVersionId()).append(")\n")
                    .append(chunk.getText().trim()).append("\n\n");
        }
        return sb.toString();
    }
}

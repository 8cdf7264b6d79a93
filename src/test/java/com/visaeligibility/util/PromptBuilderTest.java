package com.visaeligibility.util;

import com.visaeligibility.TestData;
import com.visaeligibility.dto.internal.RuleEvaluationResult;
import com.visaeligibility.dto.internal.ScoredChunk;
import com.visaeligibility.expression.ExpressionEvaluator;
import com.visaeligibility.model.FactValue;
import com.visaeligibility.service.rules.RuleEvaluationEngine;
import com.visaeligibility.service.store.memory.InMemoryRuleVersionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder promptBuilder = new PromptBuilder();

    private final RuleEvaluationEngine engine =
            new RuleEvaluationEngine(new InMemoryRuleVersionStore(), new ExpressionEvaluator(), TestData.properties());

    private static final List<ScoredChunk> CONTEXT = List.of(
            ScoredChunk.builder().chunkId("c1").documentVersionId("d1").text("Salary rules").similarity(0.9).build(),
            ScoredChunk.builder().chunkId("c2").documentVersionId("d2").text("Sponsor rules").similarity(0.8).build());

    @Test
    @DisplayName("identical inputs build identical prompts whatever the fact map order")
    void deterministic() {
        Map<String, FactValue> first = new LinkedHashMap<>();
        first.put("sponsor", FactValue.of(true));
        first.put("salary", FactValue.of(45000));
        Map<String, FactValue> second = new LinkedHashMap<>();
        second.put("salary", FactValue.of(45000));
        second.put("sponsor", FactValue.of(true));
        RuleEvaluationResult rules = engine.evaluate(TestData.skilledWorkerRules(), first);

        String a = promptBuilder.buildEligibilityPrompt(TestData.SKILLED_WORKER, first, rules, CONTEXT);
        String b = promptBuilder.buildEligibilityPrompt(TestData.SKILLED_WORKER, second, rules, CONTEXT);

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("lists sorted facts, requirement statuses and numbered context")
    void content() {
        var facts = Map.of("sponsor", FactValue.of(true), "salary", FactValue.of(45000));
        RuleEvaluationResult rules = engine.evaluate(TestData.skilledWorkerRules(), facts);

        String prompt = promptBuilder.buildEligibilityPrompt(TestData.SKILLED_WORKER, facts, rules, CONTEXT);

        assertThat(prompt).contains("SKILLED_WORKER - Skilled Worker visa (UK)");
        assertThat(prompt.indexOf("- salary: 45000")).isLessThan(prompt.indexOf("- sponsor: true"));
        assertThat(prompt).contains("- has_degree [optional]: MISSING_FACTS (missing: has_degree)");
        assertThat(prompt).contains("[1] (document d1)\nSalary rules");
        assertThat(prompt).contains("[2] (document d2)\nSponsor rules");
        assertThat(prompt).contains("OUTCOME:").contains("CONFIDENCE:");
    }

    @Test
    @DisplayName("states when no reference material was found")
    void noContext() {
        RuleEvaluationResult rules = engine.evaluate(TestData.skilledWorkerRules(), Map.of());

        assertThat(promptBuilder.buildEligibilityPrompt(TestData.SKILLED_WORKER, Map.of(), rules, List.of()))
                .contains("(no reference material found)")
                .contains("### CASE FACTS\n(none)");
    }
}

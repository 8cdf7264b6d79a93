package com.visaeligibility;

import com.visaeligibility.config.EligibilityProperties;
import com.visaeligibility.expression.ComparisonOperator;
import com.visaeligibility.expression.Compare;
import com.visaeligibility.expression.Expression;
import com.visaeligibility.expression.Literal;
import com.visaeligibility.expression.Var;
import com.visaeligibility.model.Requirement;
import com.visaeligibility.model.RuleVersion;
import com.visaeligibility.model.VisaType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Shared builders for unit tests.
 */
public final class TestData {

    public static final String VISA_ID = "uk-skilled-worker";
    public static final VisaType SKILLED_WORKER =
            new VisaType(VISA_ID, "SKILLED_WORKER", "UK", "Skilled Worker visa");
    public static final LocalDate AS_OF = LocalDate.of(2025, 6, 1);

    private TestData() {
    }

    /**
     * Defaults everywhere, with 1ms backoff so retry tests run fast.
     */
    public static EligibilityProperties properties() {
        EligibilityProperties properties = new EligibilityProperties();
        EligibilityProperties.Reasoning reasoning = new EligibilityProperties.Reasoning();
        reasoning.setInitialBackoffMillis(1L);
        properties.setReasoning(reasoning);
        return properties;
    }

    public static Expression ge(String fact, Object value) {
        return new Compare(ComparisonOperator.GE, new Var(fact), Literal.of(value));
    }

    public static Expression eq(String fact, Object value) {
        return new Compare(ComparisonOperator.EQ, new Var(fact), Literal.of(value));
    }

    public static Requirement mandatory(String code, Expression expression) {
        return new Requirement(code, null, expression, true);
    }

    public static Requirement optional(String code, Expression expression) {
        return new Requirement(code, null, expression, false);
    }

    public static RuleVersion ruleVersion(String id, Instant createdAt, Requirement... requirements) {
        return new RuleVersion(id, VISA_ID, LocalDate.of(2024, 4, 4), null, true, createdAt, List.of(requirements));
    }

    /**
     * Mandatory salary >= 38700 and sponsor == true, optional has_degree == true.
     */
    public static RuleVersion skilledWorkerRules() {
        return ruleVersion("sw-2024", Instant.parse("2024-03-14T09:00:00Z"),
                mandatory("salary_threshold", ge("salary", 38700)),
                mandatory("licensed_sponsor", eq("sponsor", true)),
                optional("has_degree", eq("has_degree", true)));
    }
}

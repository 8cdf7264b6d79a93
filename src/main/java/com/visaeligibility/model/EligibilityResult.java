package com.visaeligibility.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class EligibilityResult {

    String id;

    String caseId;

    String visaTypeId;

    String ruleVersionId;

    Outcome outcome;

    double confidence;

    String reasoningSummary;

    @Builder.Default
    List<String> missingFacts = List.of();

    // Set only when the AI path ran
    String reasoningLogId;

    Instant createdAt;
}

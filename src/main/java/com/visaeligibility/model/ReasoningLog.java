package com.visaeligibility.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class ReasoningLog {

    String id;

    String caseId;

    String prompt;

    String responseText;

    String modelName;

    TokenUsage tokenUsage;

    Instant createdAt;
}

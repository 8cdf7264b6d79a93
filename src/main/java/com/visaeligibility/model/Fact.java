package com.visaeligibility.model;

public record Fact(
        String caseId,
        String key,
        FactValue value,
        String source
) {
}

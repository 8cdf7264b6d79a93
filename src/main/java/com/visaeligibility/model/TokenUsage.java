package com.visaeligibility.model;

public record TokenUsage(
        Integer promptTokens,
        Integer completionTokens,
        Integer totalTokens
) {

    public static TokenUsage unknown() {
        return new TokenUsage(null, null, null);
    }
}

package com.visaeligibility.service.llm;

import com.visaeligibility.model.TokenUsage;

public record CompletionResponse(String text, TokenUsage tokenUsage, String modelName) {
}

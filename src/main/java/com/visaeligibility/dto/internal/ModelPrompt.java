package com.visaeligibility.dto.internal;

public record ModelPrompt(String systemPrompt, String userPrompt) {
}

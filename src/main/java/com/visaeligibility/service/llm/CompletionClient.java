package com.visaeligibility.service.llm;

public interface CompletionClient {

    /**
     * @throws com.visaeligibility.exception.ModelException on failure
     */
    CompletionResponse complete(String systemPrompt, String userPrompt);
}

package com.visaeligibility.service.llm;

import com.visaeligibility.exception.ModelException;
import com.visaeligibility.model.TokenUsage;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class OllamaCompletionClient implements CompletionClient {

    private final OllamaChatModel chatModel;
    private final OllamaOptions defaultOptions;

    @Override
    @CircuitBreaker(name = "ollama")
    public CompletionResponse complete(String systemPrompt, String userPrompt) {
        ChatResponse response;
        try {
            log.debug("Requesting completion from {}", defaultOptions.getModel());

            List<Message> messages = List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt));
            response = chatModel.call(new Prompt(messages, defaultOptions));

        } catch (TransientAiException | ResourceAccessException e) {
            log.warn("Transient model failure: {}", e.getMessage());
            throw new ModelException("Transient model failure", e, true);

        } catch (NonTransientAiException e) {
            // rate limiting surfaces as a 4xx but is worth retrying
            boolean rateLimited = e.getMessage() != null && e.getMessage().startsWith("429");
            log.warn("Model call rejected: {}", e.getMessage());
            throw new ModelException("Model call rejected", e, rateLimited);

        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("Model returned HTTP {}", status);
            throw new ModelException("Model returned HTTP " + status, e,
                    status == 429 || e.getStatusCode().is5xxServerError());
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ModelException("Model returned no output", true);
        }

        String text = response.getResult().getOutput().getText();
        String modelName = response.getMetadata() != null && response.getMetadata().getModel() != null
                && !response.getMetadata().getModel().isBlank()
                ? response.getMetadata().getModel()
                : defaultOptions.getModel();

        log.debug("Completion received ({} chars)", text == null ? 0 : text.length());
        return new CompletionResponse(text == null ? "" : text, tokenUsage(response), modelName);
    }

    private static TokenUsage tokenUsage(ChatResponse response) {
        if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return TokenUsage.unknown();
        }
        Usage usage = response.getMetadata().getUsage();
        return new TokenUsage(usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens());
    }
}

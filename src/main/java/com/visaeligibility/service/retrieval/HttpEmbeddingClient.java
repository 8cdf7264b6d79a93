package com.visaeligibility.service.retrieval;

import com.visaeligibility.config.EmbeddingConfig;
import com.visaeligibility.exception.EmbeddingException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Embeds text through the embedding service's {@code POST /embed} endpoint:
 * request {@code {"texts": [...]}}, response {@code {"embeddings": [[...]]}}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpEmbeddingClient implements EmbeddingClient {

    private final EmbeddingConfig embeddingConfig;
    private final WebClient embeddingWebClient;

    @Override
    @Cacheable(value = "embeddings", key = "#text")
    @CircuitBreaker(name = "embedding")
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Text is empty", false);
        }

        log.debug("Calling embedding service ({} chars)", text.length());

        Map<?, ?> response;
        try {
            response = embeddingWebClient.post()
                    .uri("/embed")
                    .bodyValue(Map.of("texts", List.of(text)))
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(Duration.ofSeconds(embeddingConfig.getTimeoutSeconds()));

        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 429 || e.getStatusCode().is5xxServerError();
            log.warn("Embedding service returned HTTP {}", status);
            throw new EmbeddingException("Embedding service returned HTTP " + status, e, retryable);

        } catch (RuntimeException e) {
            // connection failures and the blocking-read timeout
            log.warn("Embedding service call failed: {}", e.getMessage());
            throw new EmbeddingException("Embedding service call failed", e, true);
        }

        if (response == null || !(response.get("embeddings") instanceof List<?> embeddings) || embeddings.isEmpty()) {
            throw new EmbeddingException("Invalid response from embedding service", false);
        }

        List<Double> vector = toVector(embeddings.get(0));

        if (vector.size() != embeddingConfig.getDimension()) {
            log.warn("Embedding dimension mismatch: expected {}, got {}",
                    embeddingConfig.getDimension(), vector.size());
        }
        return vector;
    }

    private static List<Double> toVector(Object raw) {
        if (!(raw instanceof List<?> values) || values.isEmpty()) {
            throw new EmbeddingException("Empty embedding in response", false);
        }
        return values.stream()
                .map(v -> {
                    if (v instanceof Number number) {
                        return number.doubleValue();
                    }
                    throw new EmbeddingException("Non-numeric embedding component: " + v, false);
                })
                .toList();
    }
}

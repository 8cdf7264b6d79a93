package com.visaeligibility.service.reasoning;

import com.visaeligibility.config.EligibilityProperties;
import com.visaeligibility.exception.RemoteCallException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retry policies for the three remote calls of the reasoning path. Only
 * {@link RemoteCallException}s flagged retryable are retried; the last failure
 * is rethrown once attempts run out.
 */
@Slf4j
@Getter
@Component
public class RemoteCallRetries {

    private final Retry embedding;
    private final Retry search;
    private final Retry model;

    public RemoteCallRetries(EligibilityProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(properties.getInitialBackoffMillis()),
                        properties.getBackoffMultiplier()))
                .retryOnException(e -> e instanceof RemoteCallException remote && remote.isRetryable())
                .build();

        this.embedding = create("embedding", config);
        this.search = create("search", config);
        this.model = create("model", config);
    }

    private static Retry create(String name, RetryConfig config) {
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Retrying {} call (attempt {}): {}",
                        name, event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()))
                .onError(event -> log.warn("{} call failed after {} attempts",
                        name, event.getNumberOfRetryAttempts()));
        return retry;
    }
}

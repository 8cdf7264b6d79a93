package com.visaeligibility.exception;

import lombok.Getter;

/**
 * Failure of a call to an external service (embedding, similarity search, model).
 * Retryable failures are timeouts, rate limits and transient server errors;
 * malformed requests and auth failures are not retried.
 */
@Getter
public abstract class RemoteCallException extends EligibilityException {

    private final boolean retryable;

    protected RemoteCallException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    protected RemoteCallException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }
}

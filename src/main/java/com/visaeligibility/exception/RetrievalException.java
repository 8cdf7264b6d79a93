package com.visaeligibility.exception;

public class RetrievalException extends RemoteCallException {

    public RetrievalException(String message, boolean retryable) {
        super(message, retryable);
    }

    public RetrievalException(String message, Throwable cause, boolean retryable) {
        super(message, cause, retryable);
    }
}

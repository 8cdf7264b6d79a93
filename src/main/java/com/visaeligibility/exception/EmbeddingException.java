package com.visaeligibility.exception;

public class EmbeddingException extends RemoteCallException {

    public EmbeddingException(String message, boolean retryable) {
        super(message, retryable);
    }

    public EmbeddingException(String message, Throwable cause, boolean retryable) {
        super(message, cause, retryable);
    }
}

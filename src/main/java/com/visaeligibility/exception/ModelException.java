package com.visaeligibility.exception;

public class ModelException extends RemoteCallException {

    public ModelException(String message, boolean retryable) {
        super(message, retryable);
    }

    public ModelException(String message, Throwable cause, boolean retryable) {
        super(message, cause, retryable);
    }
}

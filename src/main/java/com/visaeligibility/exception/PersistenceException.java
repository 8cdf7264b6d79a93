package com.visaeligibility.exception;

public class PersistenceException extends EligibilityException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.visaeligibility.exception;

public class InvalidExpressionException extends EligibilityException {

    public InvalidExpressionException(String message) {
        super(message);
    }
}

package com.bank.categorization.integration;

public class InferenceTimeoutException extends InferenceException {

    public InferenceTimeoutException(String message) {
        super(message);
    }

    public InferenceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

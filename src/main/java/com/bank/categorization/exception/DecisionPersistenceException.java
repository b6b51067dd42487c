package com.bank.categorization.exception;

/**
 * The audit record store rejected a write on the primary path.
 */
public class DecisionPersistenceException extends RuntimeException {

    public DecisionPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

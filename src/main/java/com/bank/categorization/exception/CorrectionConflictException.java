package com.bank.categorization.exception;

/**
 * A decision already carries a different correction or review outcome.
 */
public class CorrectionConflictException extends RuntimeException {

    public CorrectionConflictException(String message) {
        super(message);
    }
}

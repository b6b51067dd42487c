package com.bank.categorization.exception;

public class DecisionNotFoundException extends RuntimeException {

    public DecisionNotFoundException(String tenantId, String decisionId) {
        super("Decision " + decisionId + " not found for tenant " + tenantId);
    }
}

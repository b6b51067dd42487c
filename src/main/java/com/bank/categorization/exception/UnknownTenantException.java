package com.bank.categorization.exception;

public class UnknownTenantException extends RuntimeException {

    private final String tenantId;

    public UnknownTenantException(String tenantId) {
        super("Unknown tenant: " + tenantId);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}

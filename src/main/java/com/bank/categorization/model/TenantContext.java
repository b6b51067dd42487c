package com.bank.categorization.model;

/**
 * Resolved tenant for the duration of one call. Only {@code TenantService} creates
 * these, and every tenant-scoped storage location is derived from one.
 */
public record TenantContext(String tenantId, int autoApplyThreshold) {

    public ReasoningPartition reasoningPartition() {
        return ReasoningPartition.forTenant(this);
    }
}

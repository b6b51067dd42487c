package com.bank.categorization.model;

import java.util.Objects;

/**
 * Name of a tenant's semantic index partition. Can only be obtained from a
 * {@link TenantContext}, never from a raw string.
 */
public final class ReasoningPartition {

    public static final String PREFIX = "reasoning-";

    private final String tenantId;
    private final String setName;

    private ReasoningPartition(String tenantId) {
        this.tenantId = tenantId;
        this.setName = PREFIX + tenantId;
    }

    static ReasoningPartition forTenant(TenantContext context) {
        return new ReasoningPartition(Objects.requireNonNull(context.tenantId(), "tenantId"));
    }

    public String tenantId() {
        return tenantId;
    }

    public String setName() {
        return setName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReasoningPartition that)) return false;
        return setName.equals(that.setName);
    }

    @Override
    public int hashCode() {
        return setName.hashCode();
    }

    @Override
    public String toString() {
        return setName;
    }
}

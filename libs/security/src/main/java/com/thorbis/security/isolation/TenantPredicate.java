package com.thorbis.security.isolation;

/**
 * The implicit {@code tenant_id = ?} filter every store call carries. There is no way to build a
 * predicate that matches more than one tenant.
 */
public record TenantPredicate(String tenantId) {

    public TenantPredicate {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
    }

    public boolean matches(Row row) {
        return row != null && tenantId.equals(row.tenantId());
    }

    public boolean matches(String candidateTenantId) {
        return tenantId.equals(candidateTenantId);
    }
}

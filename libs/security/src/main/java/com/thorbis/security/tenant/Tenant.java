package com.thorbis.security.tenant;

/**
 * A business: the root isolation boundary for all customer data.
 *
 * @param id       unique tenant identifier
 * @param industry vertical whose policy document applies
 * @param planTier subscription tier
 * @param status   lifecycle state
 */
public record Tenant(String id, Industry industry, PlanTier planTier, TenantStatus status) {

    public Tenant {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (industry == null) {
            throw new IllegalArgumentException("industry must not be null");
        }
        if (planTier == null) {
            throw new IllegalArgumentException("planTier must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    public boolean isActive() {
        return status == TenantStatus.ACTIVE;
    }

    Tenant withStatus(TenantStatus newStatus) {
        return new Tenant(id, industry, planTier, newStatus);
    }
}

package com.thorbis.security.tenant;

/**
 * Lifecycle state of a tenant. {@code CANCELLED} is the soft-deleted state and is terminal;
 * tenants are never physically removed while audit retention applies.
 */
public enum TenantStatus {
    ACTIVE,
    SUSPENDED,
    CANCELLED
}

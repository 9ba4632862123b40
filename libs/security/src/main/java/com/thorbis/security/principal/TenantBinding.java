package com.thorbis.security.principal;

import java.util.Optional;

/**
 * A principal's membership in one tenant.
 *
 * @param tenantId     the tenant
 * @param baseRole     platform-wide role, e.g. "manager"
 * @param industryRole vertical-specific role refining the base role, e.g. "technician" (nullable)
 */
public record TenantBinding(String tenantId, String baseRole, String industryRole) {

    public TenantBinding {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (baseRole == null || baseRole.isBlank()) {
            throw new IllegalArgumentException("baseRole must not be blank");
        }
        if (industryRole != null && industryRole.isBlank()) {
            industryRole = null;
        }
    }

    public Optional<String> industryRoleOpt() {
        return Optional.ofNullable(industryRole);
    }

    /** The most specific role of this binding. */
    public String mostSpecificRole() {
        return industryRole != null ? industryRole : baseRole;
    }
}

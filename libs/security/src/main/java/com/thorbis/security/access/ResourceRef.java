package com.thorbis.security.access;

import com.thorbis.security.SensitivityLevel;

import java.math.BigDecimal;

/**
 * The resource an action targets.
 *
 * @param tenantId            tenant the resource belongs to
 * @param resourceType        entity type, e.g. "work_order"
 * @param resourceId          instance id (nullable for type-level actions)
 * @param sensitivity         sensitivity level driving minimum authentication strength
 * @param assignedPrincipalId principal the resource is assigned to (nullable)
 * @param monetaryValue       amount at stake for financial actions (nullable)
 */
public record ResourceRef(
        String tenantId,
        String resourceType,
        String resourceId,
        SensitivityLevel sensitivity,
        String assignedPrincipalId,
        BigDecimal monetaryValue
) {

    public ResourceRef {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType must not be blank");
        }
        if (sensitivity == null) {
            sensitivity = SensitivityLevel.INTERNAL;
        }
    }

    public static ResourceRef of(String tenantId, String resourceType, String resourceId) {
        return new ResourceRef(tenantId, resourceType, resourceId, SensitivityLevel.INTERNAL, null, null);
    }
}

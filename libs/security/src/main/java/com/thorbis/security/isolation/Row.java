package com.thorbis.security.isolation;

import java.time.Instant;
import java.util.Map;

/**
 * A tenant-scoped entity instance as seen through the gate.
 *
 * @param tenantId     owning tenant, fixed at creation
 * @param resourceType entity type
 * @param resourceId   instance id, unique per tenant and resource type
 * @param attributes   entity attributes
 * @param state        deletion state
 * @param createdAt    creation time
 * @param deletedAt    soft-delete time (null while active)
 */
public record Row(
        String tenantId,
        String resourceType,
        String resourceId,
        Map<String, String> attributes,
        RowState state,
        Instant createdAt,
        Instant deletedAt
) {

    public Row {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public boolean isActive() {
        return state == RowState.ACTIVE;
    }
}

package com.thorbis.security.isolation;

import java.util.Map;

/**
 * A create or update through the gate.
 *
 * @param tenantId     tenant the caller believes it is writing to; null means the session's
 *                     tenant. Any other tenant is rejected.
 * @param resourceType entity type
 * @param resourceId   instance id
 * @param attributes   full replacement attribute set
 */
public record Mutation(String tenantId, String resourceType, String resourceId, Map<String, String> attributes) {

    public Mutation {
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType must not be blank");
        }
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be blank");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}

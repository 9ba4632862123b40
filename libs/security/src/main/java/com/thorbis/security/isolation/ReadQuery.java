package com.thorbis.security.isolation;

import java.util.Map;

/**
 * A read through the gate.
 *
 * @param tenantId        tenant to read; null means the session's tenant
 * @param resourceType    entity type
 * @param attributeEquals attribute equality filters
 * @param includeDeleted  also return soft-deleted rows (requires the {@code read_deleted} action)
 * @param limit           maximum rows; 0 or less means unlimited
 */
public record ReadQuery(
        String tenantId,
        String resourceType,
        Map<String, String> attributeEquals,
        boolean includeDeleted,
        int limit
) {

    public ReadQuery {
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType must not be blank");
        }
        attributeEquals = attributeEquals == null ? Map.of() : Map.copyOf(attributeEquals);
    }

    public static ReadQuery of(String resourceType) {
        return new ReadQuery(null, resourceType, Map.of(), false, 0);
    }

    public boolean matches(Row row) {
        if (!resourceType.equals(row.resourceType())) {
            return false;
        }
        for (Map.Entry<String, String> filter : attributeEquals.entrySet()) {
            if (!filter.getValue().equals(row.attributes().get(filter.getKey()))) {
                return false;
            }
        }
        return true;
    }
}

package com.thorbis.audit;

import java.time.Instant;

/**
 * Filter for {@link AuditTrail#query(AuditQuery)}. Null filters match everything.
 *
 * @param tenantId  partition to read (required)
 * @param eventType only entries of this type
 * @param severity  only entries at or above this severity
 * @param from      only entries recorded at or after this instant
 * @param to        only entries recorded before this instant
 * @param limit     maximum number of entries, newest first
 */
public record AuditQuery(
        String tenantId,
        AuditEventType eventType,
        AuditSeverity severity,
        Instant from,
        Instant to,
        int limit
) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public AuditQuery {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static AuditQuery forTenant(String tenantId) {
        return new AuditQuery(tenantId, null, null, null, null, DEFAULT_LIMIT);
    }

    boolean matches(AuditEntry entry) {
        AuditEvent event = entry.event();
        if (eventType != null && event.eventType() != eventType) {
            return false;
        }
        if (severity != null && !event.severity().isAtLeast(severity)) {
            return false;
        }
        if (from != null && entry.recordedAt().isBefore(from)) {
            return false;
        }
        return to == null || entry.recordedAt().isBefore(to);
    }
}

package com.thorbis.audit;

import java.time.Instant;
import java.util.Map;

/**
 * A fact submitted to the {@link AuditRecorder}, before it is sequenced.
 *
 * <p>Records are immutable; the recorder derives a redacted copy with {@link #withMetadata(Map)}
 * rather than editing the caller's event.
 *
 * @param eventType     what kind of fact this is
 * @param severity      how severe the fact is
 * @param tenantId      audit partition the entry belongs to
 * @param principalId   acting principal (nullable for system events)
 * @param sessionId     session the action ran under (nullable)
 * @param resource      target resource (nullable for lifecycle events)
 * @param action        action name, e.g. "complete_work_order"
 * @param outcome       decision or mutation outcome
 * @param ruleId        matched rule id for access decisions (nullable)
 * @param reasonCode    reason code for access decisions (nullable)
 * @param policyVersion policy snapshot version the decision used (nullable)
 * @param metadata      request metadata such as IP or user agent
 * @param occurredAt    when the fact happened
 */
public record AuditEvent(
        AuditEventType eventType,
        AuditSeverity severity,
        String tenantId,
        String principalId,
        String sessionId,
        AuditResource resource,
        String action,
        AuditOutcome outcome,
        String ruleId,
        String reasonCode,
        String policyVersion,
        Map<String, String> metadata,
        Instant occurredAt
) {

    public AuditEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Returns a copy carrying different metadata. */
    public AuditEvent withMetadata(Map<String, String> replacement) {
        return new AuditEvent(eventType, severity, tenantId, principalId, sessionId, resource,
                action, outcome, ruleId, reasonCode, policyVersion, replacement, occurredAt);
    }
}

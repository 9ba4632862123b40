package com.thorbis.audit;

import java.time.Instant;
import java.util.Map;

/**
 * Factory methods for the audit events the engine emits.
 * <p>
 * Centralises the severity and outcome conventions so that the evaluator, the isolation gate and
 * the session manager all describe the same fact the same way.
 */
public final class AuditEvents {

    /** Audit partition for events that belong to no tenant, e.g. policy reloads. */
    public static final String PLATFORM_TENANT = "_platform";

    private AuditEvents() {
        // utility class
    }

    /** An authorization decision. */
    public static AuditEvent accessDecision(
            String tenantId,
            String principalId,
            String sessionId,
            AuditResource resource,
            String action,
            AuditOutcome outcome,
            String ruleId,
            String reasonCode,
            String policyVersion,
            AuditSeverity severity,
            Map<String, String> metadata,
            Instant occurredAt
    ) {
        return new AuditEvent(AuditEventType.ACCESS_DECISION, severity, tenantId, principalId,
                sessionId, resource, action, outcome, ruleId, reasonCode, policyVersion, metadata,
                occurredAt);
    }

    /** A write, delete or cross-tenant read performed through the isolation gate. */
    public static AuditEvent dataAccess(
            AuditEventType type,
            String tenantId,
            String principalId,
            String sessionId,
            AuditResource resource,
            String action,
            Instant occurredAt
    ) {
        AuditSeverity severity = type == AuditEventType.CROSS_TENANT_READ
                ? AuditSeverity.HIGH
                : AuditSeverity.LOW;
        return new AuditEvent(type, severity, tenantId, principalId, sessionId, resource, action,
                AuditOutcome.SUCCESS, null, null, null, Map.of(), occurredAt);
    }

    /** A session lifecycle transition. {@code reason} lands in the reason code. */
    public static AuditEvent sessionLifecycle(
            AuditEventType type,
            String tenantId,
            String principalId,
            String sessionId,
            String reason,
            Instant occurredAt
    ) {
        AuditSeverity severity = type == AuditEventType.SESSION_REVOKED
                ? AuditSeverity.HIGH
                : AuditSeverity.LOW;
        return new AuditEvent(type, severity, tenantId, principalId, sessionId,
                new AuditResource("session", sessionId), type.value(), AuditOutcome.SUCCESS,
                null, reason, null, Map.of(), occurredAt);
    }

    /** Outcome of a policy reload, recorded in the platform partition. */
    public static AuditEvent policyReload(
            String requestedBy,
            String version,
            boolean success,
            String diagnostics,
            Instant occurredAt
    ) {
        AuditEventType type = success
                ? AuditEventType.POLICY_RELOADED
                : AuditEventType.POLICY_RELOAD_REJECTED;
        Map<String, String> metadata = diagnostics == null || diagnostics.isBlank()
                ? Map.of()
                : Map.of("diagnostics", diagnostics);
        return new AuditEvent(type, success ? AuditSeverity.MEDIUM : AuditSeverity.HIGH,
                PLATFORM_TENANT, requestedBy, null, new AuditResource("policy", version),
                "policy_reload", success ? AuditOutcome.SUCCESS : AuditOutcome.FAILURE, null,
                null, version, metadata, occurredAt);
    }

    /** A domain-specific fact, e.g. "estimate approved", reported by a business module. */
    public static AuditEvent domainFact(
            String tenantId,
            String principalId,
            String sessionId,
            AuditResource resource,
            String action,
            AuditSeverity severity,
            Map<String, String> metadata,
            Instant occurredAt
    ) {
        return new AuditEvent(AuditEventType.DOMAIN_EVENT, severity, tenantId, principalId,
                sessionId, resource, action, AuditOutcome.SUCCESS, null, null, null, metadata,
                occurredAt);
    }
}

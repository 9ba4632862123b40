package com.thorbis.audit;

import java.util.Optional;

/**
 * Kinds of facts the audit trail records.
 *
 * <p>The {@code value} is the wire representation used by the HTTP query API and in log lines.
 */
public enum AuditEventType {

    // ---- Access decisions ----
    ACCESS_DECISION("access_decision"),

    // ---- Data mutations through the isolation gate ----
    DATA_WRITE("data_write"),
    DATA_DELETE("data_delete"),
    CROSS_TENANT_READ("cross_tenant_read"),

    // ---- Session lifecycle ----
    SESSION_CREATED("session_created"),
    SESSION_TERMINATED("session_terminated"),
    SESSION_REVOKED("session_revoked"),

    // ---- Policy administration ----
    POLICY_RELOADED("policy_reloaded"),
    POLICY_RELOAD_REJECTED("policy_reload_rejected"),

    // ---- Facts reported by domain modules ----
    DOMAIN_EVENT("domain_event");

    private final String value;

    AuditEventType(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "access_decision"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an event type by its canonical value.
     *
     * @return the matching type, or empty if not found
     */
    public static Optional<AuditEventType> fromString(String value) {
        for (AuditEventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

package com.thorbis.audit;

/** Severity attached to every audit entry; drives alerting and synchronous durability. */
public enum AuditSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Whether this severity is at least as severe as {@code other}. */
    public boolean isAtLeast(AuditSeverity other) {
        return compareTo(other) >= 0;
    }
}

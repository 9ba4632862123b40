package com.thorbis.security.access;

/** Reason attached to every decision and recorded on its audit entry. */
public enum ReasonCode {

    GRANTED("granted"),
    NO_TENANT_BINDING("no_tenant_binding"),
    TENANT_INACTIVE("tenant_inactive"),
    NO_GRANT("no_grant"),
    CONSTRAINT_FAILED("constraint_failed"),
    CONFLICTING_GRANTS("conflicting_grants"),
    SENSITIVITY_REQUIREMENT("sensitivity_requirement"),
    POLICY_ERROR("policy_error"),
    SESSION_EXPIRED("session_expired"),
    SESSION_REVOKED("session_revoked"),
    UNAUTHENTICATED("unauthenticated");

    private final String value;

    ReasonCode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}

package com.thorbis.audit;

/**
 * Outcome recorded on an audit entry. Access decisions use ALLOW, DENY and POLICY_ERROR;
 * mutations and lifecycle events use SUCCESS and FAILURE.
 */
public enum AuditOutcome {
    ALLOW,
    DENY,
    POLICY_ERROR,
    SUCCESS,
    FAILURE
}

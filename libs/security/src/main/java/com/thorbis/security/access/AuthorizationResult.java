package com.thorbis.security.access;

/**
 * @param decision      full decision, for audit and owner tooling only
 * @param publicReason  the reason the caller may see
 * @param auditSequence sequence number of the decision's audit entry
 */
public record AuthorizationResult(Decision decision, String publicReason, long auditSequence) {

    public boolean isAllowed() {
        return decision.isAllowed();
    }
}

package com.thorbis.security.access;

/**
 * Thrown by guarded operations when the evaluator denied the request. The message only carries
 * the public reason.
 */
public class AccessDeniedException extends RuntimeException {

    private final transient Decision decision;

    public AccessDeniedException(Decision decision) {
        super("Access denied: " + decision.publicReason());
        this.decision = decision;
    }

    public Decision decision() {
        return decision;
    }

    public String publicReason() {
        return decision.publicReason();
    }
}

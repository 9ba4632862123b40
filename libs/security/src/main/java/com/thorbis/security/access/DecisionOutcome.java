package com.thorbis.security.access;

/**
 * Outcome of an authorization. {@code POLICY_ERROR} denies like {@code DENY} but marks that the
 * evaluator itself failed.
 */
public enum DecisionOutcome {
    ALLOW,
    DENY,
    POLICY_ERROR
}

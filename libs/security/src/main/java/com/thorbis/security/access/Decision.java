package com.thorbis.security.access;

import com.thorbis.security.ConstraintCategory;

/**
 * Result of evaluating one request.
 *
 * @param outcome          allow, deny or policy error
 * @param ruleId           rule that allowed the request (null unless allowed)
 * @param reason           why
 * @param failedConstraint category of the failed constraint or sensitivity requirement (nullable)
 * @param policyVersion    policy snapshot version used (null if none was available)
 */
public record Decision(
        DecisionOutcome outcome,
        String ruleId,
        ReasonCode reason,
        ConstraintCategory failedConstraint,
        String policyVersion
) {

    /** Reason shown to callers for any denial without a prompt-able cause. */
    public static final String NOT_AUTHORIZED = "not_authorized";

    public static Decision allow(String ruleId, String policyVersion) {
        return new Decision(DecisionOutcome.ALLOW, ruleId, ReasonCode.GRANTED, null, policyVersion);
    }

    public static Decision deny(ReasonCode reason, String policyVersion) {
        return new Decision(DecisionOutcome.DENY, null, reason, null, policyVersion);
    }

    public static Decision constraintFailed(ConstraintCategory category, String policyVersion) {
        return new Decision(DecisionOutcome.DENY, null, ReasonCode.CONSTRAINT_FAILED, category, policyVersion);
    }

    public static Decision sensitivityRequirement(ConstraintCategory category, String policyVersion) {
        return new Decision(DecisionOutcome.DENY, null, ReasonCode.SENSITIVITY_REQUIREMENT, category, policyVersion);
    }

    public static Decision policyError(String policyVersion) {
        return new Decision(DecisionOutcome.POLICY_ERROR, null, ReasonCode.POLICY_ERROR, null, policyVersion);
    }

    public boolean isAllowed() {
        return outcome == DecisionOutcome.ALLOW;
    }

    /**
     * What the caller may see. Allows report {@code granted}. Constraint and sensitivity denials
     * report only the constraint category so the caller can prompt for step-up. Everything else,
     * including unauthenticated, unbound and policy errors, is {@code not_authorized}.
     */
    public String publicReason() {
        if (isAllowed()) {
            return ReasonCode.GRANTED.value();
        }
        if ((reason == ReasonCode.CONSTRAINT_FAILED || reason == ReasonCode.SENSITIVITY_REQUIREMENT)
                && failedConstraint != null) {
            return failedConstraint.value();
        }
        return NOT_AUTHORIZED;
    }
}

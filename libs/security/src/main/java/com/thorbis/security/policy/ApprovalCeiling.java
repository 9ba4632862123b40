package com.thorbis.security.policy;

import com.thorbis.security.ConstraintCategory;

import java.math.BigDecimal;
import java.util.List;

/**
 * Resource's monetary value must not exceed {@code maxAmount}. A resource without a value fails.
 */
public record ApprovalCeiling(BigDecimal maxAmount) implements GrantConstraint {

    @Override
    public ConstraintCategory category() {
        return ConstraintCategory.APPROVAL_CEILING;
    }

    @Override
    public boolean test(ConstraintInput input) {
        return input.monetaryValue() != null && input.monetaryValue().compareTo(maxAmount) <= 0;
    }

    @Override
    public List<String> validate() {
        if (maxAmount == null) {
            return List.of("approval_ceiling requires maxAmount");
        }
        if (maxAmount.signum() < 0) {
            return List.of("approval_ceiling maxAmount must not be negative");
        }
        return List.of();
    }
}

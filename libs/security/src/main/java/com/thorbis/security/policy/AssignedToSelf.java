package com.thorbis.security.policy;

import com.thorbis.security.ConstraintCategory;

import java.util.List;

/** Resource must be assigned to the acting principal, e.g. a technician's own work orders. */
public record AssignedToSelf() implements GrantConstraint {

    @Override
    public ConstraintCategory category() {
        return ConstraintCategory.ASSIGNMENT_REQUIRED;
    }

    @Override
    public boolean test(ConstraintInput input) {
        return input.assignedPrincipalId() != null
                && input.assignedPrincipalId().equals(input.principalId());
    }

    @Override
    public List<String> validate() {
        return List.of();
    }
}

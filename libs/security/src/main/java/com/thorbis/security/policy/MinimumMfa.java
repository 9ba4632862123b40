package com.thorbis.security.policy;

import com.thorbis.security.ConstraintCategory;
import com.thorbis.security.MfaLevel;

import java.util.List;

/** Session must have satisfied at least {@code level} of second factor. */
public record MinimumMfa(MfaLevel level) implements GrantConstraint {

    @Override
    public ConstraintCategory category() {
        return ConstraintCategory.MFA_REQUIRED;
    }

    @Override
    public boolean test(ConstraintInput input) {
        return input.mfaLevel() != null && input.mfaLevel().satisfies(level);
    }

    @Override
    public List<String> validate() {
        return level == null ? List.of("minimum_mfa requires a level") : List.of();
    }
}

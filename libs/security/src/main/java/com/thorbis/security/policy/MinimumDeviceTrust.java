package com.thorbis.security.policy;

import com.thorbis.security.ConstraintCategory;
import com.thorbis.security.DeviceTrust;

import java.util.List;

/** Session must run on a device trusted at least to {@code level}. */
public record MinimumDeviceTrust(DeviceTrust level) implements GrantConstraint {

    @Override
    public ConstraintCategory category() {
        return ConstraintCategory.TRUSTED_DEVICE_REQUIRED;
    }

    @Override
    public boolean test(ConstraintInput input) {
        return input.deviceTrust() != null && input.deviceTrust().satisfies(level);
    }

    @Override
    public List<String> validate() {
        return level == null ? List.of("minimum_device_trust requires a level") : List.of();
    }
}

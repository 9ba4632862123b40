package com.thorbis.security.policy;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.thorbis.security.ConstraintCategory;

import java.util.List;

/**
 * A contextual condition narrowing when a grant applies. Constraints on one grant are
 * conjunctive.
 * <p>
 * Policy documents tag each constraint with a {@code kind}. The set of kinds is closed: adding one
 * means adding a permitted subtype here.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GeoScope.class, name = "geo_scope"),
        @JsonSubTypes.Type(value = TimeWindow.class, name = "time_window"),
        @JsonSubTypes.Type(value = MinimumMfa.class, name = "minimum_mfa"),
        @JsonSubTypes.Type(value = MinimumDeviceTrust.class, name = "minimum_device_trust"),
        @JsonSubTypes.Type(value = ApprovalCeiling.class, name = "approval_ceiling"),
        @JsonSubTypes.Type(value = AssignedToSelf.class, name = "assigned_to_self")
})
public sealed interface GrantConstraint
        permits GeoScope, TimeWindow, MinimumMfa, MinimumDeviceTrust, ApprovalCeiling, AssignedToSelf {

    /** Category reported to the caller when this constraint fails. */
    ConstraintCategory category();

    /** Whether the constraint holds for {@code input}. */
    boolean test(ConstraintInput input);

    /** Problems with the constraint's payload; empty when well-formed. */
    List<String> validate();
}

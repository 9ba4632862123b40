package com.thorbis.security.policy;

import java.util.List;

/**
 * Permission for a role to perform an action on a resource type, subject to constraints.
 *
 * @param ruleId       stable identifier reported on decisions and audit entries
 * @param role         role holding the grant
 * @param resourceType resource type
 * @param action       action name
 * @param constraints  conjunctive conditions; empty means unconditional
 */
public record Grant(
        String ruleId,
        String role,
        String resourceType,
        String action,
        List<GrantConstraint> constraints
) {

    public Grant {
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public ResourceAction resourceAction() {
        return new ResourceAction(resourceType, action);
    }
}

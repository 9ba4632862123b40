package com.thorbis.security.policy;

import java.util.List;

/**
 * A role and the roles it inherits grants from.
 *
 * @param name     role name, unique within a policy document
 * @param inherits direct parents in the inheritance graph
 */
public record RoleDefinition(String name, List<String> inherits) {

    public RoleDefinition {
        inherits = inherits == null ? List.of() : List.copyOf(inherits);
    }
}

package com.thorbis.security.policy;

import java.util.List;

/**
 * What a role set may do for one (resource type, action) pair after inheritance.
 *
 * @param resourceAction the pair
 * @param grants         grants of the nearest contributing role; any qualifying grant allows
 * @param distance       inheritance distance from the most specific role to the contributing role
 * @param conflicted     true when different roles at the same distance grant the pair with
 *                       different constraints; a conflicted permission always denies
 */
public record EffectivePermission(
        ResourceAction resourceAction,
        List<Grant> grants,
        int distance,
        boolean conflicted
) {

    public EffectivePermission {
        grants = List.copyOf(grants);
    }
}

package com.thorbis.security.policy;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Effective permission set for one role combination within one policy snapshot. Immutable.
 */
public record EffectivePermissions(String policyVersion, Map<ResourceAction, EffectivePermission> byResourceAction) {

    public EffectivePermissions {
        byResourceAction = Map.copyOf(byResourceAction);
    }

    public Optional<EffectivePermission> find(String resourceType, String action) {
        return Optional.ofNullable(byResourceAction.get(new ResourceAction(resourceType, action)));
    }

    public Set<ResourceAction> resourceActions() {
        return byResourceAction.keySet();
    }
}

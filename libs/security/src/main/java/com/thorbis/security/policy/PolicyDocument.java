package com.thorbis.security.policy;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One industry's role and permission definitions at one version, as stored and published.
 *
 * @param industry            industry value, e.g. "home_services"
 * @param version             policy version this document belongs to
 * @param resourceActions     every (resource type, action) pair grants may reference
 * @param roles               role graph
 * @param grants              role grants
 * @param crossTenantGrants   API partner exceptions
 * @param sessionIdleTimeouts idle timeout per role
 */
public record PolicyDocument(
        String industry,
        String version,
        List<ResourceAction> resourceActions,
        List<RoleDefinition> roles,
        List<Grant> grants,
        List<CrossTenantGrant> crossTenantGrants,
        Map<String, Duration> sessionIdleTimeouts
) {

    public PolicyDocument {
        resourceActions = resourceActions == null ? List.of() : List.copyOf(resourceActions);
        roles = roles == null ? List.of() : List.copyOf(roles);
        grants = grants == null ? List.of() : List.copyOf(grants);
        crossTenantGrants = crossTenantGrants == null ? List.of() : List.copyOf(crossTenantGrants);
        sessionIdleTimeouts = sessionIdleTimeouts == null ? Map.of() : Map.copyOf(sessionIdleTimeouts);
    }
}

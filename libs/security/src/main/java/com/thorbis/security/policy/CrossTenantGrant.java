package com.thorbis.security.policy;

import java.util.List;

/**
 * Explicit exception letting one API partner act on listed tenants it holds no binding for.
 * This is the only way any principal reaches a tenant outside its bindings.
 *
 * @param ruleId       stable identifier
 * @param principalId  the API partner
 * @param tenantIds    tenants the exception covers
 * @param resourceType resource type
 * @param action       action name
 * @param constraints  conjunctive conditions
 */
public record CrossTenantGrant(
        String ruleId,
        String principalId,
        List<String> tenantIds,
        String resourceType,
        String action,
        List<GrantConstraint> constraints
) {

    public CrossTenantGrant {
        tenantIds = tenantIds == null ? List.of() : List.copyOf(tenantIds);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public ResourceAction resourceAction() {
        return new ResourceAction(resourceType, action);
    }

    public boolean covers(String candidatePrincipalId, String tenantId, ResourceAction pair) {
        return principalId.equals(candidatePrincipalId)
                && tenantIds.contains(tenantId)
                && resourceAction().equals(pair);
    }
}

package com.thorbis.security.access;

import com.thorbis.observability.AccessMetrics;
import com.thorbis.security.ConstraintCategory;
import com.thorbis.security.SensitivityLevel;
import com.thorbis.security.policy.ConstraintInput;
import com.thorbis.security.policy.CrossTenantGrant;
import com.thorbis.security.policy.EffectivePermission;
import com.thorbis.security.policy.Grant;
import com.thorbis.security.policy.GrantConstraint;
import com.thorbis.security.policy.IndustryPolicy;
import com.thorbis.security.policy.PolicySnapshot;
import com.thorbis.security.policy.PolicyStore;
import com.thorbis.security.policy.ResourceAction;
import com.thorbis.security.principal.Principal;
import com.thorbis.security.principal.TenantBinding;
import com.thorbis.security.tenant.Tenant;
import com.thorbis.security.tenant.TenantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a principal may perform an action on a resource.
 * <ol>
 *   <li>No binding to the resource's tenant: Deny {@code no_tenant_binding}, unless an explicit
 *       cross-tenant grant names this API partner, tenant and action.</li>
 *   <li>Effective permissions of the binding's roles for the policy of the tenant's industry.</li>
 *   <li>Keep the permission for (resource type, action); none is {@code no_grant}, a conflicted one
 *       is {@code conflicting_grants}.</li>
 *   <li>A grant qualifies when every constraint holds.</li>
 *   <li>The resource's sensitivity level overrides any qualifying grant when the context lacks the
 *       required MFA or device trust.</li>
 *   <li>Allow with the qualifying rule id, otherwise Deny with {@code constraint_failed} and the
 *       category of the first failed constraint.</li>
 * </ol>
 * Evaluation never throws: any unexpected failure becomes a {@link DecisionOutcome#POLICY_ERROR}
 * decision.
 */
public class AccessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AccessEvaluator.class);

    private final PolicyStore policyStore;
    private final TenantRegistry tenants;
    private final AccessMetrics metrics;

    public AccessEvaluator(PolicyStore policyStore, TenantRegistry tenants, AccessMetrics metrics) {
        this.policyStore = policyStore;
        this.tenants = tenants;
        this.metrics = metrics;
    }

    public Decision authorize(Principal principal, String tenantId, ResourceRef resource, String action,
                              AccessContext context) {
        long started = System.nanoTime();
        Decision decision;
        String version = null;
        try {
            PolicySnapshot snapshot = policyStore.current();
            version = snapshot.version();
            decision = evaluate(snapshot, principal, tenantId, resource, action, context, false);
        } catch (RuntimeException e) {
            log.error("Policy error evaluating {} on {}:{} for {} in tenant {}", action,
                    resource == null ? null : resource.resourceType(),
                    resource == null ? null : resource.resourceId(),
                    principal == null ? null : principal.principalId(), tenantId, e);
            decision = Decision.policyError(version);
        }
        metrics.recordEvaluation(Duration.ofNanos(System.nanoTime() - started));
        metrics.recordDecision(decision.outcome().name().toLowerCase(Locale.ROOT), decision.reason().value());
        if (!decision.isAllowed()) {
            log.debug("Denied {} on {} for {} in tenant {}: {}", action,
                    resource == null ? null : resource.resourceType(),
                    principal == null ? null : principal.principalId(), tenantId, decision.reason().value());
        }
        return decision;
    }

    /**
     * Authorizes only through explicit cross-tenant grants, ignoring any binding. Used by the
     * isolation gate before it widens its tenant predicate.
     */
    public Decision authorizeCrossTenant(Principal principal, String tenantId, ResourceRef resource, String action,
                                         AccessContext context) {
        String version = null;
        try {
            PolicySnapshot snapshot = policyStore.current();
            version = snapshot.version();
            return evaluate(snapshot, principal, tenantId, resource, action, context, true);
        } catch (RuntimeException e) {
            log.error("Policy error evaluating cross-tenant {} for {} in tenant {}", action,
                    principal == null ? null : principal.principalId(), tenantId, e);
            return Decision.policyError(version);
        }
    }

    private Decision evaluate(PolicySnapshot snapshot, Principal principal, String tenantId, ResourceRef resource,
                              String action, AccessContext context, boolean crossTenantOnly) {
        String version = snapshot.version();
        if (principal == null || context == null || resource == null || action == null || action.isBlank()) {
            throw new IllegalArgumentException("principal, resource, action and context are required");
        }
        if (!resource.tenantId().equals(tenantId)) {
            return Decision.deny(ReasonCode.NO_TENANT_BINDING, version);
        }
        Optional<Tenant> tenant = tenants.find(tenantId);
        if (tenant.isEmpty()) {
            // indistinguishable from an unbound tenant
            return Decision.deny(ReasonCode.NO_TENANT_BINDING, version);
        }
        if (!tenant.get().isActive()) {
            return Decision.deny(ReasonCode.TENANT_INACTIVE, version);
        }
        IndustryPolicy policy = snapshot.policyFor(tenant.get().industry())
                .orElseThrow(() -> new IllegalStateException("No " + tenant.get().industry().value()
                        + " policy in version " + version));

        ConstraintInput input = new ConstraintInput(context.now(), context.region(), context.mfaLevel(),
                context.deviceTrust(), principal.principalId(), resource.assignedPrincipalId(),
                resource.monetaryValue());
        ResourceAction pair = new ResourceAction(resource.resourceType(), action);

        Optional<TenantBinding> binding = crossTenantOnly ? Optional.empty() : principal.bindingFor(tenantId);
        if (binding.isEmpty()) {
            return evaluateCrossTenant(policy, principal, tenantId, pair, resource, input, context, version);
        }

        EffectivePermission permission = policy
                .effectivePermissions(binding.get().baseRole(), binding.get().industryRole())
                .byResourceAction().get(pair);
        if (permission == null) {
            return Decision.deny(ReasonCode.NO_GRANT, version);
        }
        if (permission.conflicted()) {
            log.warn("Conflicting grants for {} via roles {}/{} in {} policy {}", pair,
                    binding.get().baseRole(), binding.get().industryRole(), policy.industry().value(), version);
            return Decision.deny(ReasonCode.CONFLICTING_GRANTS, version);
        }

        ConstraintCategory firstFailure = null;
        for (Grant grant : permission.grants()) {
            ConstraintCategory failed = firstFailedConstraint(grant.constraints(), input);
            if (failed == null) {
                return sensitivityCheck(resource.sensitivity(), context)
                        .map(category -> Decision.sensitivityRequirement(category, version))
                        .orElseGet(() -> Decision.allow(grant.ruleId(), version));
            }
            if (firstFailure == null) {
                firstFailure = failed;
            }
        }
        return Decision.constraintFailed(firstFailure, version);
    }

    private Decision evaluateCrossTenant(IndustryPolicy policy, Principal principal, String tenantId,
                                         ResourceAction pair, ResourceRef resource, ConstraintInput input,
                                         AccessContext context, String version) {
        if (!principal.isApiPartner()) {
            return Decision.deny(ReasonCode.NO_TENANT_BINDING, version);
        }
        List<CrossTenantGrant> candidates = policy.crossTenantGrants().stream()
                .filter(g -> g.covers(principal.principalId(), tenantId, pair))
                .toList();
        if (candidates.isEmpty()) {
            return Decision.deny(ReasonCode.NO_TENANT_BINDING, version);
        }
        ConstraintCategory firstFailure = null;
        for (CrossTenantGrant grant : candidates) {
            ConstraintCategory failed = firstFailedConstraint(grant.constraints(), input);
            if (failed == null) {
                return sensitivityCheck(resource.sensitivity(), context)
                        .map(category -> Decision.sensitivityRequirement(category, version))
                        .orElseGet(() -> Decision.allow(grant.ruleId(), version));
            }
            if (firstFailure == null) {
                firstFailure = failed;
            }
        }
        return Decision.constraintFailed(firstFailure, version);
    }

    private static ConstraintCategory firstFailedConstraint(List<GrantConstraint> constraints, ConstraintInput input) {
        for (GrantConstraint constraint : constraints) {
            if (!constraint.test(input)) {
                return constraint.category();
            }
        }
        return null;
    }

    private static Optional<ConstraintCategory> sensitivityCheck(SensitivityLevel sensitivity, AccessContext context) {
        if (!context.mfaLevel().satisfies(sensitivity.requiredMfa())) {
            return Optional.of(ConstraintCategory.MFA_REQUIRED);
        }
        if (!context.deviceTrust().satisfies(sensitivity.requiredDeviceTrust())) {
            return Optional.of(ConstraintCategory.TRUSTED_DEVICE_REQUIRED);
        }
        return Optional.empty();
    }
}

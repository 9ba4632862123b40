package com.thorbis.security.principal;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * An authenticated actor.
 * <p>
 * A {@link PrincipalKind#HUMAN} principal is bound to at most one tenant. Only API partners may
 * hold several bindings; this is checked at construction.
 *
 * @param principalId   user id or API partner id
 * @param kind          human or API partner
 * @param bindings      tenant memberships
 * @param mfaEnrolled   whether the principal has a second factor enrolled
 * @param trustedDevice whether the principal's registered device is trusted
 * @param homeRegion    default region when a request does not carry one (nullable)
 */
public record Principal(
        String principalId,
        PrincipalKind kind,
        List<TenantBinding> bindings,
        boolean mfaEnrolled,
        boolean trustedDevice,
        String homeRegion
) {

    public Principal {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("principalId must not be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
        if (kind == PrincipalKind.HUMAN && bindings.size() > 1) {
            throw new IllegalArgumentException(
                    "Human principal " + principalId + " cannot be bound to more than one tenant");
        }
        long distinct = bindings.stream().map(TenantBinding::tenantId).distinct().count();
        if (distinct != bindings.size()) {
            throw new IllegalArgumentException(
                    "Principal " + principalId + " has duplicate bindings for one tenant");
        }
    }

    public Optional<TenantBinding> bindingFor(String tenantId) {
        return bindings.stream().filter(b -> b.tenantId().equals(tenantId)).findFirst();
    }

    public boolean isBoundTo(String tenantId) {
        return bindingFor(tenantId).isPresent();
    }

    public boolean isApiPartner() {
        return kind == PrincipalKind.API_PARTNER;
    }

    /** Copy keeping only the bindings that satisfy {@code keep}. */
    public Principal withBindings(Predicate<TenantBinding> keep) {
        return new Principal(principalId, kind, bindings.stream().filter(keep).toList(),
                mfaEnrolled, trustedDevice, homeRegion);
    }
}

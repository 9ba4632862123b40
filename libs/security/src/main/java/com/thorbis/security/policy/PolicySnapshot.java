package com.thorbis.security.policy;

import com.thorbis.security.tenant.Industry;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of compiled industry policies sharing one version. Installed atomically by the
 * {@link PolicyStore}; decisions are tagged with {@link #version()}.
 */
public record PolicySnapshot(String version, Map<Industry, IndustryPolicy> policies, Instant loadedAt) {

    public PolicySnapshot {
        policies = Map.copyOf(policies);
    }

    public Optional<IndustryPolicy> policyFor(Industry industry) {
        return Optional.ofNullable(policies.get(industry));
    }
}

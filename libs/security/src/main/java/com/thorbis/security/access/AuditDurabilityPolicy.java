package com.thorbis.security.access;

import com.thorbis.security.SensitivityLevel;

import java.time.Duration;
import java.util.Set;

/**
 * Which decisions must be durably audited before the caller gets its answer.
 * <p>
 * Denials and policy errors on resources at or above {@code threshold}, or on any of the
 * {@code criticalActions}, are written synchronously. Everything else is recorded without waiting
 * for the store.
 *
 * @param threshold       lowest sensitivity requiring a synchronous write
 * @param criticalActions actions that always require one when denied
 * @param syncTimeout     how long a synchronous write may wait for the store
 */
public record AuditDurabilityPolicy(SensitivityLevel threshold, Set<String> criticalActions, Duration syncTimeout) {

    public AuditDurabilityPolicy {
        if (threshold == null) {
            threshold = SensitivityLevel.FINANCIAL;
        }
        criticalActions = criticalActions == null ? Set.of() : Set.copyOf(criticalActions);
        if (syncTimeout == null || syncTimeout.isNegative() || syncTimeout.isZero()) {
            syncTimeout = Duration.ofSeconds(2);
        }
    }

    public static AuditDurabilityPolicy defaults() {
        return new AuditDurabilityPolicy(SensitivityLevel.FINANCIAL, Set.of(), Duration.ofSeconds(2));
    }

    public boolean requiresSync(Decision decision, ResourceRef resource, String action) {
        if (decision.isAllowed()) {
            return false;
        }
        return resource.sensitivity().isAtLeast(threshold) || criticalActions.contains(action);
    }

    public boolean isCritical(ResourceRef resource, String action) {
        return resource.sensitivity().isAtLeast(threshold) || criticalActions.contains(action);
    }
}

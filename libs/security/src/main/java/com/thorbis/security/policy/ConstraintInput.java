package com.thorbis.security.policy;

import com.thorbis.security.DeviceTrust;
import com.thorbis.security.MfaLevel;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The facts a {@link GrantConstraint} is tested against.
 *
 * @param now                 evaluation time
 * @param region              caller's current region (nullable)
 * @param mfaLevel            second factor satisfied by the session
 * @param deviceTrust         trust level of the session's device
 * @param principalId         acting principal
 * @param assignedPrincipalId principal the resource is assigned to (nullable)
 * @param monetaryValue       amount at stake for financial actions (nullable)
 */
public record ConstraintInput(
        Instant now,
        String region,
        MfaLevel mfaLevel,
        DeviceTrust deviceTrust,
        String principalId,
        String assignedPrincipalId,
        BigDecimal monetaryValue
) {}

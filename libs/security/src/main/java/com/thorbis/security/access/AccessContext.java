package com.thorbis.security.access;

import com.thorbis.security.DeviceTrust;
import com.thorbis.security.MfaLevel;

import java.time.Instant;
import java.util.Map;

/**
 * Contextual attributes of one request, taken from the session and the request itself.
 *
 * @param now         evaluation time
 * @param region      caller's current region (nullable)
 * @param mfaLevel    second factor satisfied by the session
 * @param deviceTrust trust level of the session's device
 * @param sessionId   session the request runs under (nullable for system calls)
 * @param requestId   request identifier for correlation (nullable)
 * @param metadata    request metadata recorded on the audit entry
 */
public record AccessContext(
        Instant now,
        String region,
        MfaLevel mfaLevel,
        DeviceTrust deviceTrust,
        String sessionId,
        String requestId,
        Map<String, String> metadata
) {

    public AccessContext {
        if (now == null) {
            throw new IllegalArgumentException("now must not be null");
        }
        mfaLevel = mfaLevel == null ? MfaLevel.NONE : mfaLevel;
        deviceTrust = deviceTrust == null ? DeviceTrust.UNKNOWN : deviceTrust;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}

package com.thorbis.security.access;

import java.util.Map;

/**
 * One call to {@link AuthorizationService#authorize}.
 *
 * @param principalId acting principal
 * @param sessionId   session the request runs under
 * @param tenantId    tenant the caller is acting in
 * @param resource    target resource
 * @param action      action name
 * @param region      caller's current region (nullable; the principal's home region is used)
 * @param metadata    request metadata such as IP or user agent
 */
public record AuthorizationRequest(
        String principalId,
        String sessionId,
        String tenantId,
        ResourceRef resource,
        String action,
        String region,
        Map<String, String> metadata
) {

    public AuthorizationRequest {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}

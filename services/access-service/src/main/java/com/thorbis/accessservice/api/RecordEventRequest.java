package com.thorbis.accessservice.api;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * A domain fact a business module wants in the tenant's audit log, e.g. "estimate approved".
 *
 * @param tenantId     audit partition, must be the caller's tenant
 * @param action       what happened
 * @param resourceType affected resource type
 * @param resourceId   affected resource id
 * @param severity     {@code LOW} when absent
 * @param metadata     additional context, sensitive keys are redacted
 */
public record RecordEventRequest(
        @NotBlank String tenantId,
        @NotBlank String action,
        String resourceType,
        String resourceId,
        String severity,
        Map<String, String> metadata) {}

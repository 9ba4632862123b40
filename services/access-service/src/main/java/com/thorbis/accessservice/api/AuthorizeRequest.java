package com.thorbis.accessservice.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/authorize}. The principal and session come from the bearer token.
 *
 * @param tenantId tenant the caller is acting in
 * @param resource target resource
 * @param action   action name, e.g. {@code complete_work_order}
 * @param region   caller's current region; the principal's home region when absent
 * @param metadata request metadata recorded with the decision
 */
public record AuthorizeRequest(
        @NotBlank String tenantId,
        @NotNull @Valid Resource resource,
        @NotBlank String action,
        String region,
        Map<String, String> metadata) {

    /**
     * @param tenantId            owning tenant, the request tenant when absent
     * @param type                resource type
     * @param id                  resource id
     * @param sensitivity         sensitivity level name, {@code INTERNAL} when absent
     * @param assignedPrincipalId principal the resource is assigned to
     * @param monetaryValue       amount at stake for approval ceilings
     */
    public record Resource(
            String tenantId,
            @NotBlank String type,
            String id,
            String sensitivity,
            String assignedPrincipalId,
            BigDecimal monetaryValue) {}
}

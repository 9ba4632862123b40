package com.thorbis.accessservice.infrastructure.seed;

import com.thorbis.security.principal.Principal;
import java.util.List;

/**
 * Tenants and principals loaded into the in-process directory at startup.
 *
 * @param tenants    tenants to provision
 * @param principals principals to register
 */
public record DirectorySeed(List<TenantSeed> tenants, List<Principal> principals) {

    public DirectorySeed {
        tenants = tenants == null ? List.of() : List.copyOf(tenants);
        principals = principals == null ? List.of() : List.copyOf(principals);
    }

    /**
     * @param id       tenant id
     * @param industry industry value, e.g. {@code home_services}
     * @param planTier plan tier value, e.g. {@code professional}
     * @param status   {@code ACTIVE} when omitted
     */
    public record TenantSeed(String id, String industry, String planTier, String status) {}
}

package com.thorbis.security.tenant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Provisioned tenants and their lifecycle.
 * <p>
 * Transitions: ACTIVE and SUSPENDED may move between each other; either may move to CANCELLED,
 * which is terminal. A tenant's id and industry never change after provisioning.
 */
public class TenantRegistry {

    private static final Logger log = LoggerFactory.getLogger(TenantRegistry.class);

    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();
    private final List<TenantStatusListener> listeners = new CopyOnWriteArrayList<>();

    /** Registers a listener told about every status change after it is applied. */
    public void addListener(TenantStatusListener listener) {
        listeners.add(listener);
    }

    /**
     * Provisions a new active tenant.
     *
     * @throws IllegalStateException if the id is already provisioned, including cancelled tenants
     */
    public Tenant provision(String id, Industry industry, PlanTier planTier) {
        Tenant tenant = new Tenant(id, industry, planTier, TenantStatus.ACTIVE);
        if (tenants.putIfAbsent(id, tenant) != null) {
            throw new IllegalStateException("Tenant already provisioned: " + id);
        }
        log.info("Provisioned tenant {} ({}, {})", id, industry.value(), planTier.value());
        return tenant;
    }

    public Tenant suspend(String id) {
        return transition(id, TenantStatus.SUSPENDED);
    }

    public Tenant reactivate(String id) {
        return transition(id, TenantStatus.ACTIVE);
    }

    public Tenant cancel(String id) {
        return transition(id, TenantStatus.CANCELLED);
    }

    public Optional<Tenant> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(tenants.get(id));
    }

    /** Whether the tenant exists and is active. */
    public boolean isActive(String id) {
        return find(id).map(Tenant::isActive).orElse(false);
    }

    public List<Tenant> all() {
        return new ArrayList<>(tenants.values());
    }

    private Tenant transition(String id, TenantStatus target) {
        TenantStatus[] previous = new TenantStatus[1];
        Tenant updated = tenants.computeIfPresent(id, (key, current) -> {
            if (current.status() == TenantStatus.CANCELLED) {
                throw new IllegalStateException("Tenant " + id + " is cancelled");
            }
            previous[0] = current.status();
            return current.withStatus(target);
        });
        if (updated == null) {
            throw new IllegalArgumentException("Unknown tenant: " + id);
        }
        log.info("Tenant {} is now {}", id, target);
        if (previous[0] != target) {
            for (TenantStatusListener listener : listeners) {
                listener.statusChanged(updated, previous[0]);
            }
        }
        return updated;
    }
}

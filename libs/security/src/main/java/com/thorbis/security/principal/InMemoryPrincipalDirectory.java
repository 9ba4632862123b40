package com.thorbis.security.principal;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link PrincipalDirectory} held in memory. Role changes are made by re-registering the principal;
 * the next authorization call sees the new bindings, and listeners hear about every tenant whose
 * binding was dropped or changed.
 */
public class InMemoryPrincipalDirectory implements PrincipalDirectory {

    private final Map<String, Principal> principals = new ConcurrentHashMap<>();
    private final List<BindingChangeListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(BindingChangeListener listener) {
        listeners.add(listener);
    }

    public void register(Principal principal) {
        Principal previous = principals.put(principal.principalId(), principal);
        if (previous != null) {
            notifyChanged(previous, principal);
        }
    }

    public void remove(String principalId) {
        Principal previous = principals.remove(principalId);
        if (previous != null) {
            notifyChanged(previous, null);
        }
    }

    @Override
    public Optional<Principal> find(String principalId) {
        return principalId == null ? Optional.empty() : Optional.ofNullable(principals.get(principalId));
    }

    private void notifyChanged(Principal previous, Principal current) {
        Set<String> changed = new LinkedHashSet<>();
        for (TenantBinding before : previous.bindings()) {
            Optional<TenantBinding> after = current == null
                    ? Optional.empty()
                    : current.bindingFor(before.tenantId());
            if (after.isEmpty() || !Objects.equals(before, after.get())) {
                changed.add(before.tenantId());
            }
        }
        for (String tenantId : changed) {
            for (BindingChangeListener listener : listeners) {
                listener.bindingChanged(previous.principalId(), tenantId);
            }
        }
    }
}

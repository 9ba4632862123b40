package com.thorbis.security.principal;

/**
 * Notified after a principal's binding to a tenant was removed or now grants different roles.
 */
public interface BindingChangeListener {

    void bindingChanged(String principalId, String tenantId);
}

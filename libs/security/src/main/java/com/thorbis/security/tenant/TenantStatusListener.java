package com.thorbis.security.tenant;

/** Notified after a tenant moves to a different lifecycle state. */
public interface TenantStatusListener {

    void statusChanged(Tenant tenant, TenantStatus previous);
}

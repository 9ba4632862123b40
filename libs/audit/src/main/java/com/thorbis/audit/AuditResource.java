package com.thorbis.audit;

/**
 * The resource an audit entry refers to.
 *
 * @param resourceType entity type, e.g. "work_order", "estimate"
 * @param resourceId   instance identifier within the tenant
 */
public record AuditResource(String resourceType, String resourceId) {}

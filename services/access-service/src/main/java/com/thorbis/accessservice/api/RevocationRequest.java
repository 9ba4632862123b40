package com.thorbis.accessservice.api;

/**
 * Bulk revocation, e.g. after a role change or suspected compromise. At least one of
 * {@code principalId} and {@code tenantId} is required.
 *
 * @param principalId revoke this principal's sessions
 * @param tenantId    revoke sessions in this tenant
 * @param reason      recorded with each revocation
 */
public record RevocationRequest(String principalId, String tenantId, String reason) {}

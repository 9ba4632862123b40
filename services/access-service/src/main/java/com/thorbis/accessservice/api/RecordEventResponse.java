package com.thorbis.accessservice.api;

/**
 * @param tenantId partition the entry was written to
 * @param sequence its per-tenant sequence number
 */
public record RecordEventResponse(String tenantId, long sequence) {}

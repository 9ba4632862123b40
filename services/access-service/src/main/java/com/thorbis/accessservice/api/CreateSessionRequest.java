package com.thorbis.accessservice.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Sent by the authentication front door once it has verified the user.
 *
 * @param principalId authenticated principal
 * @param tenantId    tenant the session is for
 * @param mfaLevel    second factor satisfied at sign-in, {@code NONE} when absent
 * @param deviceTrust trust level of the device, {@code UNKNOWN} when absent
 */
public record CreateSessionRequest(
        @NotBlank String principalId, @NotBlank String tenantId, String mfaLevel, String deviceTrust) {}

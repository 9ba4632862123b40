package com.thorbis.security.principal;

import java.time.Instant;

/**
 * Claims of a token that passed verification.
 *
 * @param principalId the authenticated principal
 * @param sessionId   the session the token was issued for
 * @param expiresAt   token expiry
 */
public record VerifiedToken(String principalId, String sessionId, Instant expiresAt) {}

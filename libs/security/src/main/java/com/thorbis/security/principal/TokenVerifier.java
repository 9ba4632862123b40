package com.thorbis.security.principal;

import java.util.Optional;

/**
 * Verifies a bearer token's signature and expiry.
 */
public interface TokenVerifier {

    /** @return the verified claims, or empty if the token is malformed, forged or expired */
    Optional<VerifiedToken> verify(String token);
}

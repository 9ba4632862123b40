package com.thorbis.security.principal;

/**
 * Outcome of resolving a bearer token.
 *
 * @param principal principal with bindings limited to active tenants
 * @param sessionId session the token was issued for
 */
public record ResolvedPrincipal(Principal principal, String sessionId) {}

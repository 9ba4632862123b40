package com.thorbis.security.session;

import java.time.Duration;

/**
 * Session limits not tied to a role.
 *
 * @param defaultIdleTimeout    idle timeout for roles without a configured one
 * @param maxLifetime           absolute lifetime of any session
 * @param maxConcurrentSessions active sessions allowed per principal; the oldest is superseded
 */
public record SessionPolicy(Duration defaultIdleTimeout, Duration maxLifetime, int maxConcurrentSessions) {

    public SessionPolicy {
        if (defaultIdleTimeout == null || defaultIdleTimeout.isNegative() || defaultIdleTimeout.isZero()) {
            throw new IllegalArgumentException("defaultIdleTimeout must be positive");
        }
        if (maxLifetime == null || maxLifetime.isNegative() || maxLifetime.isZero()) {
            throw new IllegalArgumentException("maxLifetime must be positive");
        }
        if (maxConcurrentSessions < 1) {
            throw new IllegalArgumentException("maxConcurrentSessions must be >= 1");
        }
    }

    public static SessionPolicy defaults() {
        return new SessionPolicy(Duration.ofMinutes(30), Duration.ofHours(8), 5);
    }
}

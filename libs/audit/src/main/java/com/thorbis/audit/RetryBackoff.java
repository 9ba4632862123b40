package com.thorbis.audit;

import java.time.Duration;

/**
 * Exponential backoff for replaying buffered audit entries.
 *
 * @param initial    delay before the first retry
 * @param multiplier growth factor per failed attempt
 * @param max        upper bound on any delay
 */
public record RetryBackoff(Duration initial, double multiplier, Duration max) {

    public RetryBackoff {
        if (initial == null || initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (max == null || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max must be >= initial");
        }
    }

    public static RetryBackoff defaults() {
        return new RetryBackoff(Duration.ofMillis(100), 2.0, Duration.ofSeconds(30));
    }

    /** Delay before retry number {@code attempt} (0-based). */
    public Duration delayFor(int attempt) {
        double millis = initial.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        long capped = (long) Math.min(millis, (double) max.toMillis());
        return Duration.ofMillis(capped);
    }
}

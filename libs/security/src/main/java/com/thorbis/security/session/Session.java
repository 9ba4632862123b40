package com.thorbis.security.session;

import com.thorbis.security.DeviceTrust;
import com.thorbis.security.MfaLevel;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * A principal's authenticated session against one tenant.
 * <p>
 * Identity fields are fixed at creation. Mutable state (status, last activity, MFA, device trust)
 * lives in one immutable {@link State} behind an {@link AtomicReference}; every change is a
 * compare-and-set, so a refresh can never resurrect a session that was terminated concurrently.
 */
public final class Session {

    /**
     * Mutable part of a session, replaced as a whole.
     *
     * @param status            active or terminated
     * @param lastActivityAt    last authorized use
     * @param mfaLevel          strongest second factor satisfied
     * @param deviceTrust       trust level of the device
     * @param terminationReason why the session ended (null while active)
     */
    public record State(
            SessionStatus status,
            Instant lastActivityAt,
            MfaLevel mfaLevel,
            DeviceTrust deviceTrust,
            TerminationReason terminationReason
    ) {}

    private final String sessionId;
    private final String principalId;
    private final String tenantId;
    private final String role;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Duration idleTimeout;
    private final AtomicReference<State> state;

    Session(String sessionId, String principalId, String tenantId, String role, Instant createdAt,
            Instant expiresAt, Duration idleTimeout, MfaLevel mfaLevel, DeviceTrust deviceTrust) {
        this.sessionId = sessionId;
        this.principalId = principalId;
        this.tenantId = tenantId;
        this.role = role;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.idleTimeout = idleTimeout;
        this.state = new AtomicReference<>(
                new State(SessionStatus.ACTIVE, createdAt, mfaLevel, deviceTrust, null));
    }

    public String sessionId() {
        return sessionId;
    }

    public String principalId() {
        return principalId;
    }

    public String tenantId() {
        return tenantId;
    }

    /** Role whose idle timeout governs this session. */
    public String role() {
        return role;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public Duration idleTimeout() {
        return idleTimeout;
    }

    public State state() {
        return state.get();
    }

    public boolean isActive() {
        return state.get().status() == SessionStatus.ACTIVE;
    }

    public Instant lastActivityAt() {
        return state.get().lastActivityAt();
    }

    public MfaLevel mfaLevel() {
        return state.get().mfaLevel();
    }

    public DeviceTrust deviceTrust() {
        return state.get().deviceTrust();
    }

    public Optional<TerminationReason> terminationReason() {
        return Optional.ofNullable(state.get().terminationReason());
    }

    /** The reason this session should end at {@code now}, if it has timed out. */
    public Optional<TerminationReason> timeoutAt(Instant now) {
        if (!now.isBefore(expiresAt)) {
            return Optional.of(TerminationReason.EXPIRED);
        }
        if (Duration.between(state.get().lastActivityAt(), now).compareTo(idleTimeout) > 0) {
            return Optional.of(TerminationReason.IDLE_TIMEOUT);
        }
        return Optional.empty();
    }

    /** Refreshes activity. Returns false if the session is no longer active. */
    boolean touch(Instant now) {
        return updateActive(s -> new State(s.status(),
                now.isAfter(s.lastActivityAt()) ? now : s.lastActivityAt(),
                s.mfaLevel(), s.deviceTrust(), null));
    }

    /** Raises the satisfied MFA level; never lowers it. */
    boolean stepUp(MfaLevel level, Instant now) {
        return updateActive(s -> new State(s.status(), now,
                s.mfaLevel().satisfies(level) ? s.mfaLevel() : level, s.deviceTrust(), null));
    }

    /** Moves to TERMINATED. Returns true only for the caller that performed the transition. */
    boolean terminate(TerminationReason reason) {
        return updateActive(s -> new State(SessionStatus.TERMINATED, s.lastActivityAt(),
                s.mfaLevel(), s.deviceTrust(), reason));
    }

    private boolean updateActive(UnaryOperator<State> change) {
        while (true) {
            State current = state.get();
            if (current.status() != SessionStatus.ACTIVE) {
                return false;
            }
            if (state.compareAndSet(current, change.apply(current))) {
                return true;
            }
        }
    }
}

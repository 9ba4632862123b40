package com.thorbis.security.policy;

import com.thorbis.audit.AuditEvents;
import com.thorbis.audit.AuditRecorder;
import com.thorbis.observability.AccessMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the active {@link PolicySnapshot}.
 * <p>
 * Readers call {@link #current()} and never block: a reload compiles the new version off to the
 * side and swaps the reference only when compilation succeeded. Reloads are serialized against
 * each other. A rejected reload leaves the previous snapshot active and reports every diagnostic.
 */
public class PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final PolicyDocumentSource source;
    private final String initialVersion;
    private final Clock clock;
    private final AccessMetrics metrics;
    private final AuditRecorder auditRecorder;
    private final AtomicReference<PolicySnapshot> active = new AtomicReference<>();
    private final ReentrantLock reloadLock = new ReentrantLock();

    public PolicyStore(PolicyDocumentSource source, String initialVersion, Clock clock,
                       AccessMetrics metrics, AuditRecorder auditRecorder) {
        this.source = source;
        this.initialVersion = initialVersion;
        this.clock = clock;
        this.metrics = metrics;
        this.auditRecorder = auditRecorder;
    }

    /**
     * Loads the initial version at startup.
     *
     * @throws PolicyValidationException if the documents are invalid
     * @throws PolicyLoadException       if they cannot be read
     */
    public PolicySnapshot loadPolicies() {
        reloadLock.lock();
        try {
            PolicySnapshot snapshot = PolicyCompiler.compile(initialVersion, source.load(initialVersion), clock);
            active.set(snapshot);
            log.info("Loaded policy version {} for industries {}", snapshot.version(), snapshot.policies().keySet());
            return snapshot;
        } finally {
            reloadLock.unlock();
        }
    }

    /**
     * Publishes a new version.
     *
     * @param version     version to activate
     * @param requestedBy principal performing the reload, recorded in the audit trail
     */
    public PolicyReloadResult reload(String version, String requestedBy) {
        reloadLock.lock();
        try {
            PolicyReloadResult result;
            try {
                PolicySnapshot snapshot = PolicyCompiler.compile(version, source.load(version), clock);
                active.set(snapshot);
                result = PolicyReloadResult.accepted(version);
                log.info("Policy version {} activated by {}", version, requestedBy);
            } catch (PolicyValidationException e) {
                result = PolicyReloadResult.rejected(version, activeVersion(), e.diagnostics());
                log.warn("Policy version {} rejected, keeping {}: {}", version, activeVersion(), e.diagnostics());
            } catch (PolicyLoadException e) {
                result = PolicyReloadResult.rejected(version, activeVersion(), List.of(e.getMessage()));
                log.warn("Policy version {} could not be loaded, keeping {}: {}", version, activeVersion(),
                        e.getMessage());
            }
            metrics.recordPolicyReload(result.success() ? "success" : "rejected");
            auditRecorder.record(AuditEvents.policyReload(requestedBy, version, result.success(),
                    String.join("; ", result.diagnostics()), clock.instant()));
            return result;
        } finally {
            reloadLock.unlock();
        }
    }

    /**
     * The active snapshot.
     *
     * @throws IllegalStateException if no policy has been loaded
     */
    public PolicySnapshot current() {
        PolicySnapshot snapshot = active.get();
        if (snapshot == null) {
            throw new IllegalStateException("No policy snapshot loaded");
        }
        return snapshot;
    }

    public Optional<PolicySnapshot> find() {
        return Optional.ofNullable(active.get());
    }

    private String activeVersion() {
        PolicySnapshot snapshot = active.get();
        return snapshot == null ? null : snapshot.version();
    }
}

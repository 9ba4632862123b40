package com.thorbis.audit;

import com.thorbis.observability.AccessMetrics;
import com.thorbis.observability.MetadataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Sequences audit events and delivers them to the {@link AuditStore}.
 * <p>
 * Every event gets the next sequence number of its tenant partition and a hash linking it to its
 * predecessor. If the store rejects a write, the entry goes to the {@link DurableAuditBuffer} and
 * a background task replays the buffer with exponential backoff. While anything is buffered, new
 * entries queue behind it so the store receives each partition in order. Allocation and delivery
 * of one tenant's entry happen under that tenant's partition lock.
 * <p>
 * {@link #record(AuditEvent)} returns once the entry is persisted or buffered.
 * {@link #recordDurably(AuditEvent, Duration)} additionally waits for the store to acknowledge.
 */
public class AuditRecorder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final AuditStore store;
    private final DurableAuditBuffer buffer;
    private final RetryBackoff backoff;
    private final Clock clock;
    private final AccessMetrics metrics;
    private final MetadataRedactor redactor;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final SequenceAllocator allocator;

    private final AtomicBoolean retryScheduled = new AtomicBoolean();
    private final AtomicInteger attempt = new AtomicInteger();
    private volatile boolean closed;

    public AuditRecorder(AuditStore store, DurableAuditBuffer buffer, RetryBackoff backoff,
                         Clock clock, AccessMetrics metrics, MetadataRedactor redactor) {
        this(store, buffer, backoff, clock, metrics, redactor,
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "audit-replay");
                    t.setDaemon(true);
                    return t;
                }), true);
    }

    public AuditRecorder(AuditStore store, DurableAuditBuffer buffer, RetryBackoff backoff,
                         Clock clock, AccessMetrics metrics, MetadataRedactor redactor,
                         ScheduledExecutorService scheduler) {
        this(store, buffer, backoff, clock, metrics, redactor, scheduler, false);
    }

    private AuditRecorder(AuditStore store, DurableAuditBuffer buffer, RetryBackoff backoff,
                          Clock clock, AccessMetrics metrics, MetadataRedactor redactor,
                          ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.store = store;
        this.buffer = buffer;
        this.backoff = backoff;
        this.clock = clock;
        this.metrics = metrics;
        this.redactor = redactor;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.allocator = new SequenceAllocator(this::tailOf);

        metrics.updateAuditBufferDepth(buffer.size());
        if (!buffer.isEmpty()) {
            scheduleRetry();
        }
    }

    /**
     * Sequences and stores an event, buffering it if the store is unavailable.
     *
     * @throws IllegalArgumentException if the event is incomplete
     */
    public AuditEntry record(AuditEvent event) {
        return sequenceAndDeliver(event).entry();
    }

    /**
     * Sequences an event and waits until the store has acknowledged it.
     *
     * @throws AuditWriteFailedException if the store did not acknowledge within {@code timeout};
     *                                   the entry remains buffered
     */
    public AuditEntry recordDurably(AuditEvent event, Duration timeout) {
        Delivery delivery = sequenceAndDeliver(event);
        AuditEntry entry = delivery.entry();
        if (delivery.acknowledged()) {
            return entry;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                flush();
            } catch (IllegalStateException e) {
                log.error("Audit store refused buffered entries while waiting for {}#{}",
                        entry.tenantId(), entry.sequence(), e);
                throw new AuditWriteFailedException(entry, e);
            }
            if (!buffer.contains(entry)) {
                return entry;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                Thread.sleep(Math.max(1, Math.min(TimeUnit.NANOSECONDS.toMillis(remaining),
                        backoff.initial().toMillis())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.error("Audit entry {}#{} ({}) not persisted within {}ms",
                entry.tenantId(), entry.sequence(), event.eventType().value(), timeout.toMillis());
        throw new AuditWriteFailedException(entry, timeout);
    }

    /**
     * Replays buffered entries now.
     *
     * @return number of entries delivered
     */
    public int flush() {
        int delivered = buffer.drainTo(store);
        metrics.updateAuditBufferDepth(buffer.size());
        if (delivered > 0) {
            log.info("Replayed {} buffered audit entries, {} remaining", delivered, buffer.size());
        }
        return delivered;
    }

    /** Entries waiting in the durable buffer. */
    public int bufferedCount() {
        return buffer.size();
    }

    /** Last sequence number allocated in a tenant partition, 0 if none. */
    public long lastSequence(String tenantId) {
        return allocator.lastSequence(tenantId);
    }

    @Override
    public void close() {
        closed = true;
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private Delivery sequenceAndDeliver(AuditEvent event) {
        ValidationResult validation = AuditEventValidator.validate(event);
        if (!validation.valid()) {
            throw new IllegalArgumentException("Invalid audit event: " + validation.errors());
        }
        AuditEvent redacted = event.withMetadata(redactor.redact(event.metadata()));
        return allocator.next(redacted, clock.instant(), entry -> new Delivery(entry, deliver(entry)));
    }

    /** @return true if the store acknowledged the entry, false if it was buffered */
    private boolean deliver(AuditEntry entry) {
        if (!buffer.isEmpty()) {
            buffer.append(entry);
            metrics.updateAuditBufferDepth(buffer.size());
            scheduleRetry();
            return false;
        }
        try {
            store.append(entry);
            return true;
        } catch (AuditStoreUnavailableException e) {
            metrics.recordAuditWriteFailure();
            log.warn("Audit store unavailable, buffering entry {}#{}: {}",
                    entry.tenantId(), entry.sequence(), e.getMessage());
            buffer.append(entry);
            metrics.updateAuditBufferDepth(buffer.size());
            scheduleRetry();
            return false;
        }
    }

    private void scheduleRetry() {
        if (closed || !retryScheduled.compareAndSet(false, true)) {
            return;
        }
        Duration delay = backoff.delayFor(attempt.get());
        try {
            scheduler.schedule(this::replayBuffered, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            retryScheduled.set(false);
            log.warn("Audit replay not scheduled, {} entries remain buffered", buffer.size(), e);
        }
    }

    private void replayBuffered() {
        retryScheduled.set(false);
        try {
            flush();
        } catch (RuntimeException e) {
            log.error("Audit buffer replay failed", e);
        }
        if (buffer.isEmpty()) {
            attempt.set(0);
        } else {
            metrics.recordAuditWriteFailure();
            attempt.incrementAndGet();
            scheduleRetry();
        }
    }

    private record Delivery(AuditEntry entry, boolean acknowledged) {
    }

    private Optional<AuditEntry> tailOf(String tenantId) {
        return Stream.concat(store.lastEntry(tenantId).stream(), buffer.tail(tenantId).stream())
                .max(Comparator.comparingLong(AuditEntry::sequence));
    }
}

package com.thorbis.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Local, fsync'd holding area for entries the {@link AuditStore} could not accept.
 * <p>
 * Entries are appended as JSON lines to {@code audit-buffer.jsonl} and forced to disk before
 * {@link #append(AuditEntry)} returns, so a buffered entry survives a process crash. On
 * construction the file is read back and its entries are pending again.
 */
public class DurableAuditBuffer {

    private static final Logger log = LoggerFactory.getLogger(DurableAuditBuffer.class);

    static final String FILE_NAME = "audit-buffer.jsonl";

    private final Path file;
    private final Deque<AuditEntry> pending = new ArrayDeque<>();

    public DurableAuditBuffer(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create audit buffer directory " + directory, e);
        }
        this.file = directory.resolve(FILE_NAME);
        recover();
    }

    /** Appends and fsyncs one entry. */
    public synchronized void append(AuditEntry entry) {
        String line = AuditEntrySerializer.serialize(entry) + "\n";
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer bytes = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
            while (bytes.hasRemaining()) {
                channel.write(bytes);
            }
            channel.force(true);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write audit buffer " + file, e);
        }
        pending.addLast(entry);
    }

    /**
     * Replays pending entries into {@code store} in buffer order, stopping at the first failure.
     *
     * @return number of entries delivered
     */
    public synchronized int drainTo(AuditStore store) {
        int delivered = 0;
        Iterator<AuditEntry> it = pending.iterator();
        while (it.hasNext()) {
            AuditEntry entry = it.next();
            try {
                store.append(entry);
            } catch (AuditStoreUnavailableException e) {
                log.debug("Audit store still unavailable, {} entries remain buffered: {}",
                        pending.size(), e.getMessage());
                break;
            }
            it.remove();
            delivered++;
        }
        if (delivered > 0) {
            rewrite();
        }
        return delivered;
    }

    public synchronized boolean contains(AuditEntry entry) {
        for (AuditEntry candidate : pending) {
            if (candidate.tenantId().equals(entry.tenantId())
                    && candidate.sequence() == entry.sequence()) {
                return true;
            }
        }
        return false;
    }

    /** Highest-sequenced buffered entry for a tenant. */
    public synchronized Optional<AuditEntry> tail(String tenantId) {
        AuditEntry tail = null;
        for (AuditEntry entry : pending) {
            if (entry.tenantId().equals(tenantId)
                    && (tail == null || entry.sequence() > tail.sequence())) {
                tail = entry;
            }
        }
        return Optional.ofNullable(tail);
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    public Path file() {
        return file;
    }

    private void recover() {
        if (!Files.exists(file)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    pending.addLast(AuditEntrySerializer.deserialize(line));
                } catch (AuditSerializationException e) {
                    // a torn final write after a crash; the entry was never acknowledged
                    log.warn("Skipping unreadable audit buffer line {} in {}", lineNumber, file, e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read audit buffer " + file, e);
        }
        if (!pending.isEmpty()) {
            log.warn("Recovered {} undelivered audit entries from {}", pending.size(), file);
        }
    }

    private void rewrite() {
        List<String> lines = new ArrayList<>(pending.size());
        for (AuditEntry entry : pending) {
            lines.add(AuditEntrySerializer.serialize(entry));
        }
        Path temp = file.resolveSibling(FILE_NAME + ".tmp");
        try {
            Files.write(temp, lines, StandardCharsets.UTF_8);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                channel.force(true);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot rewrite audit buffer " + file, e);
        }
    }
}

package com.thorbis.audit;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * SHA-256 hash chain over a tenant's audit partition.
 * <p>
 * {@code entryHash = sha256(previousHash | tenantId | sequence | recordedAt | canonicalJson(event))}.
 * Editing any stored entry changes its hash and breaks the link to its successor.
 */
public final class AuditHasher {

    /** previousHash of the first entry in every partition. */
    public static final String GENESIS_HASH = "0".repeat(64);

    private AuditHasher() {
        // utility class
    }

    public static String hash(String previousHash, String tenantId, long sequence,
                              Instant recordedAt, AuditEvent event) {
        String input = previousHash + '|' + tenantId + '|' + sequence + '|' + recordedAt + '|'
                + AuditEntrySerializer.canonicalJson(event);
        return sha256Hex(input);
    }

    /** Whether the entry's stored hash matches its content. */
    public static boolean matchesContent(AuditEntry entry) {
        String expected = hash(entry.previousHash(), entry.tenantId(), entry.sequence(),
                entry.recordedAt(), entry.event());
        return expected.equals(entry.entryHash());
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

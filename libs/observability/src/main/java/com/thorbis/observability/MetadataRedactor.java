package com.thorbis.observability;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credential-like values in request metadata before it is logged or written to the audit
 * trail.
 * <p>
 * Keys are compared case-insensitively after dropping {@code -} and {@code _}, so
 * {@code X-Api-Key}, {@code api_key} and {@code apiKey} all match {@code apikey}.
 */
public final class MetadataRedactor {

    /** Replacement written in place of a sensitive value. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_KEY_FRAGMENTS = Set.of(
            "password", "token", "secret", "authorization", "apikey",
            "cookie", "cardnumber", "cvv", "ssn"
    );

    private final Set<String> keyFragments;

    public MetadataRedactor() {
        this(DEFAULT_KEY_FRAGMENTS);
    }

    /** @param keyFragments lower-case key fragments that mark a value as sensitive */
    public MetadataRedactor(Set<String> keyFragments) {
        this.keyFragments = Set.copyOf(keyFragments);
    }

    /**
     * Returns a copy of {@code metadata} with sensitive values replaced. Insertion order is kept;
     * {@code null} input yields an empty map.
     */
    public Map<String, String> redact(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>(metadata.size());
        metadata.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    /** Whether the given metadata key names a sensitive value. */
    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String normalized = key.toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (String fragment : keyFragments) {
            if (normalized.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}

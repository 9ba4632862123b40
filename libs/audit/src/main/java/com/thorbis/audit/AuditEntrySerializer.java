package com.thorbis.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON serialization for {@link AuditEntry} and {@link AuditEvent}.
 * <p>
 * Properties and map keys are written in sorted order so that the same event always produces the
 * same bytes; {@link AuditHasher} relies on this canonical form.
 */
public final class AuditEntrySerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private AuditEntrySerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .build();
    }

    /**
     * Serializes an entry to a single-line JSON string.
     *
     * @throws AuditSerializationException if serialization fails
     */
    public static String serialize(AuditEntry entry) {
        try {
            return MAPPER.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException(
                    "Failed to serialize audit entry " + entry.tenantId() + "#" + entry.sequence(), e);
        }
    }

    /**
     * Deserializes an entry previously written by {@link #serialize(AuditEntry)}.
     *
     * @throws AuditSerializationException if the JSON is malformed
     */
    public static AuditEntry deserialize(String json) {
        try {
            return MAPPER.readValue(json, AuditEntry.class);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to deserialize audit entry", e);
        }
    }

    /** Canonical JSON of an event, used as hash input. */
    public static String canonicalJson(AuditEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException(
                    "Failed to serialize audit event " + event.eventType(), e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }
}

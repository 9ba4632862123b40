package com.thorbis.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuditEntrySerializer")
class AuditEntrySerializerTest {

    @Test
    @DisplayName("serialized entry reads back with a matching hash")
    void hashSurvivesSerialization() {
        var allocator = new SequenceAllocator(t -> java.util.Optional.empty());
        var entry = allocator.next(AuditTestEvents.decision("tenant-a", AuditOutcome.ALLOW),
                AuditTestEvents.NOW);

        var json = AuditEntrySerializer.serialize(entry);
        var restored = AuditEntrySerializer.deserialize(json);

        assertThat(json).doesNotContain("\n");
        assertThat(restored).isEqualTo(entry);
        assertThat(AuditHasher.matchesContent(restored)).isTrue();
    }

    @Test
    @DisplayName("canonical JSON ignores metadata insertion order")
    void canonicalOrdering() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("ip", "10.0.0.1");
        first.put("userAgent", "ios");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("userAgent", "ios");
        second.put("ip", "10.0.0.1");

        var a = AuditTestEvents.decision("tenant-a", AuditOutcome.DENY, AuditSeverity.MEDIUM, first);
        var b = AuditTestEvents.decision("tenant-a", AuditOutcome.DENY, AuditSeverity.MEDIUM, second);

        assertThat(AuditEntrySerializer.canonicalJson(a))
                .isEqualTo(AuditEntrySerializer.canonicalJson(b));
    }

    @Test
    @DisplayName("malformed JSON raises AuditSerializationException")
    void malformed() {
        assertThatThrownBy(() -> AuditEntrySerializer.deserialize("{not json"))
                .isInstanceOf(AuditSerializationException.class);
    }
}

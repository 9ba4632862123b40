package com.thorbis.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetadataRedactor")
class MetadataRedactorTest {

    private final MetadataRedactor redactor = new MetadataRedactor();

    @Test
    @DisplayName("masks credential-like keys regardless of case and separators")
    void masksSensitiveKeys() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("X-Api-Key", "k-123");
        metadata.put("Authorization", "Bearer abc");
        metadata.put("card_number", "4111111111111111");
        metadata.put("ip", "10.0.0.1");

        var redacted = redactor.redact(metadata);

        assertThat(redacted).containsEntry("X-Api-Key", MetadataRedactor.REDACTED)
                .containsEntry("Authorization", MetadataRedactor.REDACTED)
                .containsEntry("card_number", MetadataRedactor.REDACTED)
                .containsEntry("ip", "10.0.0.1");
        assertThat(redacted.keySet()).containsExactly("X-Api-Key", "Authorization", "card_number", "ip");
    }

    @Test
    @DisplayName("null or empty metadata yields an empty map")
    void emptyInput() {
        assertThat(redactor.redact(null)).isEmpty();
        assertThat(redactor.redact(Map.of())).isEmpty();
    }

    @Test
    @DisplayName("custom fragments replace the defaults")
    void customFragments() {
        var custom = new MetadataRedactor(Set.of("estimate"));

        assertThat(custom.isSensitive("estimateTotal")).isTrue();
        assertThat(custom.isSensitive("password")).isFalse();
        assertThat(custom.isSensitive(null)).isFalse();
    }
}

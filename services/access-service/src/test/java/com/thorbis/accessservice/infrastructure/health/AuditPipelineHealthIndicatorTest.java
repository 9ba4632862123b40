package com.thorbis.accessservice.infrastructure.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.thorbis.audit.AuditRecorder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

@DisplayName("AuditPipelineHealthIndicator")
class AuditPipelineHealthIndicatorTest {

    private final AuditRecorder recorder = mock(AuditRecorder.class);
    private final AuditPipelineHealthIndicator indicator = new AuditPipelineHealthIndicator(recorder);

    @Test
    @DisplayName("is UP with an empty buffer")
    void upWhenDrained() {
        when(recorder.bufferedCount()).thenReturn(0);

        var health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("bufferedEntries", 0);
    }

    @Test
    @DisplayName("is DEGRADED while entries wait for the store")
    void degradedWhileBuffered() {
        when(recorder.bufferedCount()).thenReturn(3);

        var health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(AuditPipelineHealthIndicator.DEGRADED);
        assertThat(health.getDetails()).containsEntry("bufferedEntries", 3);
    }
}

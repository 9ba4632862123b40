package com.thorbis.security.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.thorbis.audit.AuditEntry;
import com.thorbis.audit.AuditEventType;
import com.thorbis.audit.AuditEvents;
import com.thorbis.audit.AuditRecorder;
import com.thorbis.audit.DurableAuditBuffer;
import com.thorbis.audit.InMemoryAuditStore;
import com.thorbis.audit.RetryBackoff;
import com.thorbis.observability.AccessMetrics;
import com.thorbis.observability.MetadataRedactor;
import com.thorbis.security.tenant.Industry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for PolicyStore (load and reload of policy snapshots).
 *
 * <p>WHY: Verify that a rejected document never replaces the active snapshot.
 */
@DisplayName("PolicyStore")
class PolicyStoreTest {

    @TempDir
    Path dir;

    private SimpleMeterRegistry registry;
    private InMemoryAuditStore auditStore;
    private AuditRecorder recorder;
    private PolicyStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        AccessMetrics metrics = new AccessMetrics(registry, "policy-test");
        auditStore = new InMemoryAuditStore();
        recorder = new AuditRecorder(auditStore, new DurableAuditBuffer(dir), RetryBackoff.defaults(),
                Clock.systemUTC(), metrics, new MetadataRedactor());
        store = new PolicyStore(new ClasspathPolicyDocumentSource("policies"), "2026.03", Clock.systemUTC(),
                metrics, recorder);
    }

    @AfterEach
    void tearDown() {
        recorder.close();
    }

    private BigDecimal managerCeiling() {
        Grant grant = store.current().policyFor(Industry.HOME_SERVICES).orElseThrow()
                .effectivePermissions("manager", null)
                .find("estimate", "approve_estimate").orElseThrow()
                .grants().get(0);
        return ((ApprovalCeiling) grant.constraints().get(0)).maxAmount();
    }

    @Test
    @DisplayName("has no snapshot until loaded")
    void notLoaded() {
        assertThat(store.find()).isEmpty();
        assertThatThrownBy(store::current).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("loads the initial version")
    void loads() {
        store.loadPolicies();

        assertThat(store.current().version()).isEqualTo("2026.03");
        assertThat(store.current().policyFor(Industry.RESTAURANT)).isPresent();
        assertThat(managerCeiling()).isEqualByComparingTo("5000");
    }

    @Test
    @DisplayName("activates a valid new version and audits it")
    void reloadAccepted() {
        store.loadPolicies();

        PolicyReloadResult result = store.reload("2026.04", "platform-admin");

        assertThat(result.success()).isTrue();
        assertThat(result.activeVersion()).isEqualTo("2026.04");
        assertThat(managerCeiling()).isEqualByComparingTo("10000");
        assertThat(auditStore.entries(AuditEvents.PLATFORM_TENANT)).extracting(e -> e.event().eventType())
                .containsExactly(AuditEventType.POLICY_RELOADED);
        assertThat(registry.get(AccessMetrics.POLICY_RELOADS).tag("result", "success").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("rejects a cyclic version with diagnostics and keeps the previous snapshot")
    void reloadRejectsCycle() {
        PolicySnapshot before = store.loadPolicies();

        PolicyReloadResult result = store.reload("2026.05-cyclic", "platform-admin");

        assertThat(result.success()).isFalse();
        assertThat(result.activeVersion()).isEqualTo("2026.03");
        assertThat(result.diagnostics()).anySatisfy(d ->
                assertThat(d).contains("cycle").contains("A").contains("B"));
        assertThat(store.current()).isSameAs(before);

        List<AuditEntry> audit = auditStore.entries(AuditEvents.PLATFORM_TENANT);
        assertThat(audit).singleElement().satisfies(e -> {
            assertThat(e.event().eventType()).isEqualTo(AuditEventType.POLICY_RELOAD_REJECTED);
            assertThat(e.event().metadata().get("diagnostics")).contains("cycle");
        });
    }

    @Test
    @DisplayName("rejects a version that does not exist")
    void reloadUnknownVersion() {
        store.loadPolicies();

        PolicyReloadResult result = store.reload("2030.01", "platform-admin");

        assertThat(result.success()).isFalse();
        assertThat(store.current().version()).isEqualTo("2026.03");
    }

    @Test
    @DisplayName("activates documents published programmatically")
    void publishedSource() {
        var source = new InMemoryPolicyDocumentSource().publish(PolicyFixtures.VERSION,
                PolicyFixtures.document(List.of(new ResourceAction("work_order", "read")),
                        List.of(PolicyFixtures.role("viewer")),
                        List.of(PolicyFixtures.grant("r-1", "viewer", "work_order", "read"))));
        var published = new PolicyStore(source, PolicyFixtures.VERSION, Clock.systemUTC(),
                new AccessMetrics(registry, "policy-test"), recorder);

        published.loadPolicies();

        assertThat(published.current().version()).isEqualTo(PolicyFixtures.VERSION);
        assertThat(published.current().policyFor(Industry.HOME_SERVICES)).isPresent();
        assertThat(published.current().policyFor(Industry.RESTAURANT)).isEmpty();
        assertThat(published.reload("missing", "platform-admin").success()).isFalse();
    }
}

package com.thorbis.security.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for TenantRegistry (tenant lifecycle).
 *
 * <p>WHY: Verify that CANCELLED is terminal and that listeners hear every status change.
 */
@DisplayName("TenantRegistry")
class TenantRegistryTest {

    private TenantRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TenantRegistry();
        registry.provision("biz-1", Industry.HOME_SERVICES, PlanTier.PROFESSIONAL);
    }

    @Test
    @DisplayName("provisions tenants as active")
    void provisionActive() {
        assertThat(registry.isActive("biz-1")).isTrue();
        assertThat(registry.find("biz-1")).get()
                .extracting(Tenant::industry)
                .isEqualTo(Industry.HOME_SERVICES);
    }

    @Test
    @DisplayName("rejects provisioning an existing id")
    void duplicateId() {
        assertThatThrownBy(() -> registry.provision("biz-1", Industry.RESTAURANT, PlanTier.STARTER))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("suspends and reactivates")
    void suspendReactivate() {
        registry.suspend("biz-1");
        assertThat(registry.isActive("biz-1")).isFalse();
        assertThat(registry.find("biz-1").orElseThrow().status()).isEqualTo(TenantStatus.SUSPENDED);

        registry.reactivate("biz-1");
        assertThat(registry.isActive("biz-1")).isTrue();
    }

    @Test
    @DisplayName("cancellation is terminal")
    void cancelTerminal() {
        registry.cancel("biz-1");

        assertThat(registry.find("biz-1")).isPresent();
        assertThatThrownBy(() -> registry.reactivate("biz-1")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> registry.provision("biz-1", Industry.HOME_SERVICES, PlanTier.STARTER))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("listeners hear status changes but not repeats of the current status")
    void listeners() {
        List<String> heard = new ArrayList<>();
        registry.addListener((tenant, previous) -> heard.add(previous + "->" + tenant.status()));

        registry.suspend("biz-1");
        registry.suspend("biz-1");
        registry.cancel("biz-1");

        assertThat(heard).containsExactly("ACTIVE->SUSPENDED", "SUSPENDED->CANCELLED");
    }

    @Test
    @DisplayName("unknown tenants are not active and cannot transition")
    void unknownTenant() {
        assertThat(registry.isActive("nope")).isFalse();
        assertThat(registry.find(null)).isEmpty();
        assertThatThrownBy(() -> registry.suspend("nope")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("parses industry values")
    void industryValues() {
        assertThat(Industry.fromString("home_services")).contains(Industry.HOME_SERVICES);
        assertThat(Industry.fromString("HOME_SERVICES")).isEmpty();
        assertThat(Industry.isKnown("payroll")).isTrue();
        assertThat(Industry.isKnown("banking")).isFalse();
    }
}

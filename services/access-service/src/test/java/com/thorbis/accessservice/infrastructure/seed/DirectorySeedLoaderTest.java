package com.thorbis.accessservice.infrastructure.seed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.thorbis.accessservice.config.AccessProperties;
import com.thorbis.security.principal.InMemoryPrincipalDirectory;
import com.thorbis.security.principal.Principal;
import com.thorbis.security.principal.PrincipalKind;
import com.thorbis.security.principal.TenantBinding;
import com.thorbis.security.tenant.TenantRegistry;
import com.thorbis.security.tenant.TenantStatus;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.core.io.DefaultResourceLoader;

@DisplayName("DirectorySeedLoader")
class DirectorySeedLoaderTest {

    private final TenantRegistry tenants = new TenantRegistry();
    private final InMemoryPrincipalDirectory directory = new InMemoryPrincipalDirectory();

    private DirectorySeedLoader loaderFor(String seedLocation) {
        var properties = new AccessProperties("access-service", "test",
                "0123456789abcdef0123456789abcdef", null, seedLocation,
                new AccessProperties.Policy(null, "2026.03"), null, null);
        return new DirectorySeedLoader(new DefaultResourceLoader(), properties, tenants, directory);
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("provisions tenants in their seeded status")
        void tenantStatus() {
            var seed = new DirectorySeed(List.of(
                    new DirectorySeed.TenantSeed("biz-1", "home_services", "professional", null),
                    new DirectorySeed.TenantSeed("biz-9", "home_services", "starter", "SUSPENDED"),
                    new DirectorySeed.TenantSeed("rest-3", "restaurant", "enterprise", "cancelled")),
                    List.of());

            loaderFor("classpath:none.json").apply(seed);

            assertThat(tenants.find("biz-1")).hasValueSatisfying(
                    t -> assertThat(t.status()).isEqualTo(TenantStatus.ACTIVE));
            assertThat(tenants.find("biz-9")).hasValueSatisfying(
                    t -> assertThat(t.status()).isEqualTo(TenantStatus.SUSPENDED));
            assertThat(tenants.find("rest-3")).hasValueSatisfying(
                    t -> assertThat(t.status()).isEqualTo(TenantStatus.CANCELLED));
        }

        @Test
        @DisplayName("registers principals")
        void principals() {
            var owner = new Principal("owner-1", PrincipalKind.HUMAN,
                    List.of(new TenantBinding("biz-1", "owner", null)), true, true, null);

            loaderFor("classpath:none.json").apply(new DirectorySeed(List.of(), List.of(owner)));

            assertThat(directory.find("owner-1")).contains(owner);
        }

        @Test
        @DisplayName("rejects an unknown industry")
        void unknownIndustry() {
            var seed = new DirectorySeed(
                    List.of(new DirectorySeed.TenantSeed("x-1", "shipyards", "starter", null)), null);

            assertThatThrownBy(() -> loaderFor("classpath:none.json").apply(seed))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("shipyards");
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("leaves the directory empty when the seed is missing")
        void missingSeed() {
            loaderFor("classpath:seed/does-not-exist.json").run(new DefaultApplicationArguments());

            assertThat(tenants.all()).isEmpty();
        }

        @Test
        @DisplayName("loads a seed file")
        void loadsFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("directory.json");
            Files.writeString(file, """
                    {
                      "tenants": [
                        {"id": "biz-5", "industry": "home_services", "planTier": "starter"}
                      ],
                      "principals": [
                        {"principalId": "tech-5", "kind": "HUMAN",
                         "bindings": [{"tenantId": "biz-5", "baseRole": "staff",
                                       "industryRole": "technician"}],
                         "mfaEnrolled": false, "trustedDevice": true}
                      ]
                    }
                    """, StandardCharsets.UTF_8);

            loaderFor(file.toUri().toString()).run(new DefaultApplicationArguments());

            assertThat(tenants.isActive("biz-5")).isTrue();
            assertThat(directory.find("tech-5")).hasValueSatisfying(
                    p -> assertThat(p.isBoundTo("biz-5")).isTrue());
        }

        @Test
        @DisplayName("fails startup on a malformed seed")
        void malformedSeed(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("directory.json");
            Files.writeString(file, "{\"tenants\": [], \"owners\": []}", StandardCharsets.UTF_8);

            assertThatThrownBy(() -> loaderFor(file.toUri().toString())
                    .run(new DefaultApplicationArguments()))
                    .isInstanceOf(UncheckedIOException.class);
        }
    }
}

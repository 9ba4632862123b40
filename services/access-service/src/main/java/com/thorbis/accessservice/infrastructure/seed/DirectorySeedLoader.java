package com.thorbis.accessservice.infrastructure.seed;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thorbis.accessservice.config.AccessProperties;
import com.thorbis.security.principal.InMemoryPrincipalDirectory;
import com.thorbis.security.principal.Principal;
import com.thorbis.security.tenant.Industry;
import com.thorbis.security.tenant.PlanTier;
import com.thorbis.security.tenant.TenantRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Provisions tenants and registers principals from {@code thorbis.access.seed-location}.
 *
 * <p>A missing seed resource leaves the directory empty. A malformed one fails startup.
 */
@Component
@Order(0)
public class DirectorySeedLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DirectorySeedLoader.class);

    private final ResourceLoader resourceLoader;
    private final AccessProperties properties;
    private final TenantRegistry tenants;
    private final InMemoryPrincipalDirectory directory;
    private final ObjectMapper mapper;

    public DirectorySeedLoader(ResourceLoader resourceLoader, AccessProperties properties,
            TenantRegistry tenants, InMemoryPrincipalDirectory directory) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
        this.tenants = tenants;
        this.directory = directory;
        this.mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public void run(ApplicationArguments args) {
        Resource resource = resourceLoader.getResource(properties.seedLocation());
        if (!resource.exists()) {
            log.warn("No directory seed at {}, starting with an empty directory",
                    properties.seedLocation());
            return;
        }
        DirectorySeed seed;
        try (InputStream in = resource.getInputStream()) {
            seed = mapper.readValue(in, DirectorySeed.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read directory seed " + properties.seedLocation(), e);
        }
        apply(seed);
        log.info("Seeded {} tenants and {} principals from {}", seed.tenants().size(),
                seed.principals().size(), properties.seedLocation());
    }

    void apply(DirectorySeed seed) {
        for (DirectorySeed.TenantSeed tenant : seed.tenants()) {
            Industry industry = Industry.fromString(tenant.industry())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown industry '" + tenant.industry() + "' for tenant " + tenant.id()));
            PlanTier tier = PlanTier.fromString(tenant.planTier())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown plan tier '" + tenant.planTier() + "' for tenant " + tenant.id()));
            tenants.provision(tenant.id(), industry, tier);
            if ("SUSPENDED".equalsIgnoreCase(tenant.status())) {
                tenants.suspend(tenant.id());
            } else if ("CANCELLED".equalsIgnoreCase(tenant.status())) {
                tenants.cancel(tenant.id());
            }
        }
        for (Principal principal : seed.principals()) {
            directory.register(principal);
        }
    }
}

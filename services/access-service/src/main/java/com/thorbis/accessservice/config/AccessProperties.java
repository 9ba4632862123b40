package com.thorbis.accessservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the access service, bound from {@code thorbis.access.*}.
 *
 * <pre>
 * thorbis:
 *   access:
 *     service-name: access-service
 *     environment: production
 *     token-secret: ${THORBIS_TOKEN_SECRET}
 *     operator-principals: [auth-front-door, policy-admin]
 *     policy:
 *       location: policies
 *       version: 2026.03
 *     audit:
 *       buffer-dir: /var/lib/thorbis/audit
 *       sync-timeout: 2s
 *       sensitivity-threshold: FINANCIAL
 *       critical-actions: [refund_invoice, void_order]
 *     session:
 *       default-idle-timeout: 30m
 *       max-lifetime: 8h
 *       max-concurrent: 5
 * </pre>
 *
 * @param serviceName        name used in logs and the {@code service} metric tag
 * @param environment        deployment environment
 * @param tokenSecret        HMAC key shared with the token issuer, at least 32 bytes
 * @param operatorPrincipals principals allowed to open sessions, reload policy and revoke across
 *                           tenants
 * @param seedLocation       resource holding the tenant and principal directory to load at start
 * @param policy             policy document source
 * @param audit              audit recorder durability
 * @param session            session limits
 */
@Validated
@ConfigurationProperties(prefix = "thorbis.access")
public record AccessProperties(
        @NotBlank String serviceName,
        String environment,
        @NotBlank String tokenSecret,
        Set<String> operatorPrincipals,
        String seedLocation,
        @NotNull @Valid Policy policy,
        @Valid Audit audit,
        @Valid Session session) {

    public AccessProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        operatorPrincipals = operatorPrincipals == null ? Set.of() : Set.copyOf(operatorPrincipals);
        if (seedLocation == null || seedLocation.isBlank()) {
            seedLocation = "classpath:seed/directory.json";
        }
        if (tokenSecret != null && tokenSecret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalArgumentException("thorbis.access.token-secret must be at least 32 bytes");
        }
        if (audit == null) {
            audit = new Audit(null, null, null, null, null, null);
        }
        if (session == null) {
            session = new Session(null, null, 0, null, null);
        }
    }

    public byte[] tokenSecretBytes() {
        return tokenSecret.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @param location classpath directory holding {@code <version>/<industry>.json}
     * @param version  version loaded at startup
     */
    public record Policy(String location, @NotBlank String version) {

        public Policy {
            if (location == null || location.isBlank()) {
                location = "policies";
            }
        }
    }

    /**
     * @param bufferDir            directory of the durable local buffer
     * @param retryInitial         first replay delay after a store failure
     * @param retryMax             longest replay delay
     * @param syncTimeout          how long a synchronous write may wait for the store
     * @param sensitivityThreshold lowest sensitivity whose denials are written synchronously
     * @param criticalActions      actions whose denials are always written synchronously
     */
    public record Audit(
            Path bufferDir,
            Duration retryInitial,
            Duration retryMax,
            Duration syncTimeout,
            String sensitivityThreshold,
            Set<String> criticalActions) {

        public Audit {
            if (bufferDir == null) {
                bufferDir = Path.of(System.getProperty("java.io.tmpdir"), "thorbis-audit");
            }
            if (retryInitial == null) {
                retryInitial = Duration.ofMillis(200);
            }
            if (retryMax == null) {
                retryMax = Duration.ofSeconds(30);
            }
            if (syncTimeout == null) {
                syncTimeout = Duration.ofSeconds(2);
            }
            if (sensitivityThreshold == null || sensitivityThreshold.isBlank()) {
                sensitivityThreshold = "FINANCIAL";
            }
            criticalActions = criticalActions == null ? Set.of() : Set.copyOf(criticalActions);
        }
    }

    /**
     * @param defaultIdleTimeout     idle timeout for roles the policy gives none
     * @param maxLifetime            absolute session lifetime
     * @param maxConcurrent          active sessions per principal
     * @param revocationAuditTimeout how long a revocation waits for its audit record
     * @param sweepInterval          how often expired sessions are swept
     */
    public record Session(
            Duration defaultIdleTimeout,
            Duration maxLifetime,
            @Min(0) int maxConcurrent,
            Duration revocationAuditTimeout,
            Duration sweepInterval) {

        public Session {
            if (defaultIdleTimeout == null) {
                defaultIdleTimeout = Duration.ofMinutes(30);
            }
            if (maxLifetime == null) {
                maxLifetime = Duration.ofHours(8);
            }
            if (maxConcurrent <= 0) {
                maxConcurrent = 5;
            }
            if (revocationAuditTimeout == null) {
                revocationAuditTimeout = Duration.ofSeconds(2);
            }
            if (sweepInterval == null) {
                sweepInterval = Duration.ofMinutes(1);
            }
        }
    }
}

package com.thorbis.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and migration settings for the relational store that backs tenants, policy
 * documents, sessions and the audit log.
 *
 * <pre>{@code
 * thorbis:
 *   access-store:
 *     url: jdbc:postgresql://localhost:5432/thorbis_access
 *     username: thorbis
 *     password: thorbis_dev_password
 *     locations: classpath:db/migration/access
 *     enabled: true
 * }</pre>
 *
 * @param url JDBC connection URL
 * @param username database user
 * @param password database password, may be empty for trust-authenticated local databases
 * @param locations Flyway migration locations, defaults to {@link #DEFAULT_LOCATIONS}
 * @param enabled whether migrations run on startup
 */
@Validated
@ConfigurationProperties(prefix = "thorbis.access-store")
public record AccessStoreProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        boolean enabled) {

    /** Classpath directory holding the access schema migrations. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/access";

    public AccessStoreProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
        if (password == null) {
            password = "";
        }
    }
}

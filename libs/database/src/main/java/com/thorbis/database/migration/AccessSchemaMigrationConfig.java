package com.thorbis.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Runs the access schema migrations against the store configured under {@code
 * thorbis.access-store}.
 *
 * <p>WHY: Services importing this configuration exclude Spring Boot's own {@code
 * FlywayAutoConfiguration}; only the {@link #ACCESS_FLYWAY_BEAN} instance may touch the schema.
 */
@Configuration
@EnableConfigurationProperties(AccessStoreProperties.class)
@ConditionalOnProperty(prefix = "thorbis.access-store", name = "enabled", havingValue = "true")
public class AccessSchemaMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(AccessSchemaMigrationConfig.class);

    /** Bean name of the Flyway instance owning the access schema. */
    public static final String ACCESS_FLYWAY_BEAN = "accessFlyway";

    /** Schema history table, kept apart from any application-owned Flyway history. */
    public static final String HISTORY_TABLE = "access_schema_history";

    @Bean(name = ACCESS_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway accessFlyway(AccessStoreProperties properties) {
        log.info(
                "Configuring access schema migrations url={} locations={}",
                properties.url(),
                properties.locations());
        return createFlyway(properties);
    }

    static Flyway createFlyway(AccessStoreProperties properties) {
        DataSource dataSource =
                DataSourceBuilder.create()
                        .url(properties.url())
                        .username(properties.username())
                        .password(properties.password())
                        .build();

        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations().split(","))
                .table(HISTORY_TABLE)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}

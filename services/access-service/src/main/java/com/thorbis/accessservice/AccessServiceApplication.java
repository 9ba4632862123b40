package com.thorbis.accessservice;

import com.thorbis.accessservice.config.AccessProperties;
import com.thorbis.database.migration.AccessSchemaMigrationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Thorbis access service: authorization decisions, audit recording, session lifecycle and policy
 * reload over HTTP.
 *
 * <p>Schema migrations for the access store run only when {@code thorbis.access-store.enabled} is
 * set; Spring Boot's own datasource and Flyway auto-configuration stay off.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableConfigurationProperties(AccessProperties.class)
@EnableScheduling
@Import(AccessSchemaMigrationConfig.class)
public class AccessServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AccessServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AccessServiceApplication.class, args);
        log.info("Thorbis access service started");
    }
}

package com.libris.database.migration;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the service's own datasource.
 *
 * <p>Spring Boot's Flyway auto-configuration stays disabled ({@code spring.flyway.enabled: false});
 * {@link FlywayMigrationConfig} builds the instance from these values instead.
 *
 * <pre>{@code
 * libris:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration
 *     baseline-on-migrate: false
 * }</pre>
 *
 * @param enabled           whether to migrate on startup
 * @param locations         Flyway migration locations
 * @param baselineOnMigrate baseline a non-empty schema that has no history table
 */
@Validated
@ConfigurationProperties(prefix = "libris.flyway")
public record FlywayConfigProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("classpath:db/migration") @NotEmpty List<String> locations,
        @DefaultValue("false") boolean baselineOnMigrate) {}

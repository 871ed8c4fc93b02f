package com.libris.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway setup for the service datasource.
 *
 * <p>The bean migrates as its init method, so anything depending on {@link #FLYWAY_BEAN} (or on the
 * {@link MigrationStatusService}) sees the migrated schema. Services importing this configuration
 * disable {@link FlywayAutoConfiguration}:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "libris.flyway", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FlywayMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    public static final String FLYWAY_BEAN = "librisFlyway";

    @Bean(name = FLYWAY_BEAN, initMethod = "migrate")
    public Flyway librisFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        log.info("Configuring Flyway migrations from {}", properties.locations());
        return createFlyway(dataSource, properties);
    }

    @Bean
    public MigrationStatusService migrationStatusService(Flyway librisFlyway) {
        return new MigrationStatusService(librisFlyway);
    }

    static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations().toArray(String[]::new))
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }
}

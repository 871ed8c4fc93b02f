package com.libris.catalog;

import com.libris.catalog.config.CatalogProperties;
import com.libris.catalog.config.PaginationProperties;
import com.libris.catalog.config.TokenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Libris catalog service.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>correlation ID propagation and RFC 7807 error bodies
 *   <li>Flyway migrations through {@code libris.flyway}
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({
    CatalogProperties.class,
    TokenProperties.class,
    PaginationProperties.class
})
public class CatalogServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(CatalogServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CatalogServiceApplication.class, args);
        log.info("Libris catalog service started");
    }
}

package com.libris.catalog.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity and web settings, bound from {@code libris.service.*}.
 *
 * <pre>
 * libris:
 *   service:
 *     name: catalog-service
 *     environment: production
 *     description: Book catalog
 *     cors-allowed-origins:
 *       - https://books.example.com
 * </pre>
 *
 * @param name               service name used for logging, metrics and tracing. Required.
 * @param environment        deployment environment (development, staging, production)
 * @param description        human-readable description for {@code /api/v1/info}
 * @param corsAllowedOrigins origins allowed to call {@code /api/**}
 */
@ConfigurationProperties(prefix = "libris.service")
@Validated
public record CatalogProperties(
        @NotBlank String name,
        String environment,
        String description,
        List<String> corsAllowedOrigins) {

    public CatalogProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
        corsAllowedOrigins = corsAllowedOrigins == null ? List.of() : List.copyOf(corsAllowedOrigins);
    }
}

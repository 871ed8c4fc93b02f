package com.libris.catalog.api;

import com.libris.catalog.config.CatalogProperties;
import com.libris.database.migration.MigrationStatusService;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight runtime info. Actuator's {@code /actuator/info} carries build metadata; this adds
 * the service identity and, when migrations are managed here, the schema version.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final CatalogProperties properties;
    private final ObjectProvider<MigrationStatusService> migrations;

    public ServiceInfoController(
            CatalogProperties properties, ObjectProvider<MigrationStatusService> migrations) {
        this.properties = properties;
        this.migrations = migrations;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description());
        info.put("status", "running");
        info.put("timestamp", Instant.now().toString());
        migrations.ifAvailable(m -> info.put("schemaVersion", m.status().currentVersion()));
        return info;
    }
}

package com.libris.database.migration;

import java.util.Objects;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;

/**
 * Reports the schema state of the service database.
 *
 * <p>This is a POJO (no Spring annotations); {@link FlywayMigrationConfig} wires it.
 */
public class MigrationStatusService {

    /**
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion    current schema version, null if nothing is applied
     */
    public record SchemaStatus(int appliedMigrations, int pendingMigrations, String currentVersion) {}

    private final Flyway flyway;

    public MigrationStatusService(Flyway flyway) {
        this.flyway = Objects.requireNonNull(flyway, "flyway");
    }

    public SchemaStatus status() {
        MigrationInfoService info = flyway.info();
        MigrationInfo current = info.current();
        return new SchemaStatus(
                info.applied().length,
                info.pending().length,
                current == null || current.getVersion() == null ? null : current.getVersion().getVersion());
    }
}

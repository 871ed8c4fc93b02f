/**
 * Flyway migration configuration for the service datasource.
 *
 * <ul>
 *   <li>{@link com.libris.database.migration.FlywayConfigProperties}: externalized settings
 *   <li>{@link com.libris.database.migration.FlywayMigrationConfig}: the migrating Flyway bean
 *   <li>{@link com.libris.database.migration.MigrationStatusService}: applied/pending summary
 * </ul>
 */
package com.libris.database.migration;

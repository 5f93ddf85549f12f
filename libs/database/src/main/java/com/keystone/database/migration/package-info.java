/**
 * Flyway migration configuration and utilities.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.keystone.database.migration.FlywayConfigProperties}: externalized
 *       {@code keystone.flyway.*} configuration
 *   <li>{@link com.keystone.database.migration.FlywayMigrationConfig}: the {@code keystoneFlyway}
 *       bean, migrated on startup
 *   <li>{@link com.keystone.database.migration.MigrationService}: schema status reporting
 * </ul>
 */
package com.keystone.database.migration;

package com.keystone.database.migration;

import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.MigrationVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Read-only view of the schema migration state. */
public class MigrationService {

    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    /**
     * @param version     migration version, null for repeatable migrations
     * @param description migration description
     * @param state       Flyway state name, e.g. {@code SUCCESS} or {@code PENDING}
     * @param installedOn ISO-8601 install time, null when not applied
     */
    public record MigrationInfo(String version, String description, String state, String installedOn) {}

    /**
     * @param appliedMigrations successfully applied migrations
     * @param pendingMigrations migrations waiting to be applied
     * @param currentVersion    current schema version, null before the first migration
     */
    public record SchemaStatus(int appliedMigrations, int pendingMigrations, String currentVersion) {}

    private final Flyway flyway;

    public MigrationService(Flyway flyway) {
        this.flyway = flyway;
    }

    public SchemaStatus status() {
        MigrationInfoService info = flyway.info();
        org.flywaydb.core.api.MigrationInfo current = info.current();
        MigrationVersion version = current == null ? null : current.getVersion();
        SchemaStatus status = new SchemaStatus(
                info.applied().length, info.pending().length, version == null ? null : version.getVersion());
        log.debug("Schema status: {}", status);
        return status;
    }

    public List<MigrationInfo> migrations() {
        return Arrays.stream(flyway.info().all())
                .map(m -> new MigrationInfo(
                        m.getVersion() == null ? null : m.getVersion().getVersion(),
                        m.getDescription(),
                        m.getState().name(),
                        m.getInstalledOn() == null ? null : m.getInstalledOn().toInstant().toString()))
                .toList();
    }
}

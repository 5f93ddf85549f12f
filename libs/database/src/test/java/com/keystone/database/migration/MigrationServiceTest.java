package com.keystone.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.database.TestDatabase;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MigrationService")
class MigrationServiceTest {

    private DataSource dataSource;
    private MigrationService service;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabase.create();
        service = new MigrationService(TestDatabase.flyway(dataSource));
    }

    @AfterEach
    void tearDown() throws Exception {
        TestDatabase.close(dataSource);
    }

    @Test
    @DisplayName("should report the applied schema version")
    void shouldReportStatus() {
        MigrationService.SchemaStatus status = service.status();

        assertThat(status.appliedMigrations()).isEqualTo(2);
        assertThat(status.pendingMigrations()).isZero();
        assertThat(status.currentVersion()).isEqualTo("2");
    }

    @Test
    @DisplayName("should list migrations in order with their state")
    void shouldListMigrations() {
        assertThat(service.migrations())
                .extracting(MigrationService.MigrationInfo::description)
                .containsExactly("audit logs", "users teams");
        assertThat(service.migrations())
                .allSatisfy(m -> {
                    assertThat(m.state()).isEqualTo("SUCCESS");
                    assertThat(m.installedOn()).isNotNull();
                });
    }

    @Test
    @DisplayName("should be idempotent when migrating an up-to-date schema")
    void shouldMigrateIdempotently() {
        Flyway flyway = TestDatabase.flyway(dataSource);

        assertThat(flyway.migrate().migrationsExecuted).isZero();
    }
}

package com.keystone.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Migration SQL resources")
class MigrationResourceTest {

    @Test
    @DisplayName("V1 creates the audit trail and chain head tables")
    void auditSchema() throws IOException {
        String sql = readClasspathResource("db/migration/V1__audit_logs.sql");

        assertThat(sql).containsIgnoringCase("CREATE TABLE audit_logs");
        assertThat(sql).containsIgnoringCase("CREATE TABLE audit_chain_heads");
        assertThat(sql).contains("previous_hash").contains("current_hash");
    }

    @Test
    @DisplayName("V2 creates users and teams with a per-organization slug constraint")
    void entitySchema() throws IOException {
        String sql = readClasspathResource("db/migration/V2__users_teams.sql");

        assertThat(sql).containsIgnoringCase("CREATE TABLE users");
        assertThat(sql).containsIgnoringCase("CREATE TABLE teams");
        assertThat(sql).contains("UNIQUE (organization_id, slug)");
    }

    @Test
    @DisplayName("defaults point at the bundled migrations")
    void defaults() {
        FlywayConfigProperties defaults = FlywayConfigProperties.defaults();

        assertThat(defaults.locations()).isEqualTo("classpath:db/migration");
        assertThat(defaults.enabled()).isTrue();
        assertThat(new FlywayConfigProperties(true, " ", false).locations())
                .isEqualTo(FlywayConfigProperties.DEFAULT_LOCATIONS);
    }

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource '%s' must be on the classpath", path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}

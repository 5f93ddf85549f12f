package com.keystone.database.user;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.compliance.UserStatistics;
import com.keystone.database.TestDatabase;
import com.keystone.security.OrgFilter;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("JdbcUserDirectory")
class JdbcUserDirectoryTest {

    private static final OffsetDateTime CREATED = OffsetDateTime.of(2026, 1, 5, 9, 0, 0, 0, ZoneOffset.UTC);

    private DataSource dataSource;
    private JdbcTemplate jdbc;
    private JdbcUserDirectory directory;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabase.create();
        jdbc = new JdbcTemplate(dataSource);
        directory = new JdbcUserDirectory(jdbc);

        insert("org-1", UserStatus.ACTIVE, true, false);
        insert("org-1", UserStatus.ACTIVE, false, false);
        insert("org-1", UserStatus.BLOCKED, true, false);
        insert("org-1", UserStatus.PENDING, false, false);
        insert("org-1", UserStatus.ACTIVE, true, true);
        insert("org-2", UserStatus.ACTIVE, true, false);
        insert(null, UserStatus.ACTIVE, false, false);
    }

    @AfterEach
    void tearDown() throws Exception {
        TestDatabase.close(dataSource);
    }

    @Test
    @DisplayName("should count an organization's users and skip deleted ones")
    void shouldCountOrganization() {
        UserStatistics stats = directory.statistics(OrgFilter.organization("org-1", false));

        assertThat(stats.totalUsers()).isEqualTo(4);
        assertThat(stats.activeUsers()).isEqualTo(2);
        assertThat(stats.blockedUsers()).isEqualTo(1);
        assertThat(stats.emailVerifiedUsers()).isEqualTo(2);
        assertThat(stats.verificationRate()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("should count every user when unrestricted")
    void shouldCountAll() {
        assertThat(directory.statistics(OrgFilter.unrestricted()).totalUsers()).isEqualTo(6);
        assertThat(directory.statistics(OrgFilter.globalOnly()).totalUsers()).isEqualTo(1);
    }

    @Test
    @DisplayName("should report a zero verification rate when there are no users")
    void shouldHandleEmptyOrganization() {
        UserStatistics stats = directory.statistics(OrgFilter.organization("org-empty", false));

        assertThat(stats).isEqualTo(UserStatistics.empty());
    }

    private void insert(String orgId, UserStatus status, boolean verified, boolean deleted) {
        String id = UUID.randomUUID().toString();
        jdbc.update("INSERT INTO users (id, subject_id, organization_id, email, email_verified, status,"
                        + " created_at, updated_at, deleted_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                id, "auth0|" + id, orgId, id + "@example.com", verified, UserStatus.CODES.encode(status),
                CREATED, CREATED, deleted ? CREATED : null);
    }
}

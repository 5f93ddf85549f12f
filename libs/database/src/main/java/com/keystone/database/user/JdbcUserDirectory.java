package com.keystone.database.user;

import com.keystone.compliance.UserDirectory;
import com.keystone.compliance.UserStatistics;
import com.keystone.database.OrgFilterSql;
import com.keystone.security.OrgFilter;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;

/** User statistics from the {@code users} table. Soft-deleted users are not counted. */
public class JdbcUserDirectory implements UserDirectory {

    private final JdbcTemplate jdbc;

    public JdbcUserDirectory(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public UserStatistics statistics(OrgFilter scope) {
        List<Object> args = new ArrayList<>();
        args.add(UserStatus.CODES.encode(UserStatus.ACTIVE));
        args.add(UserStatus.CODES.encode(UserStatus.BLOCKED));
        String where = " WHERE deleted_at IS NULL"
                + OrgFilterSql.condition(scope, "organization_id", args).map(c -> " AND " + c).orElse("");
        return jdbc.queryForObject(
                "SELECT COUNT(*) AS total,"
                        + " COALESCE(SUM(CASE WHEN status = ? THEN 1 ELSE 0 END), 0) AS active,"
                        + " COALESCE(SUM(CASE WHEN status = ? THEN 1 ELSE 0 END), 0) AS blocked,"
                        + " COALESCE(SUM(CASE WHEN email_verified THEN 1 ELSE 0 END), 0) AS verified"
                        + " FROM users" + where,
                (rs, rowNum) -> UserStatistics.of(
                        rs.getLong("total"), rs.getLong("active"), rs.getLong("blocked"), rs.getLong("verified")),
                args.toArray());
    }
}

package com.keystone.accessservice.infrastructure.persistence;

import com.keystone.accessservice.domain.team.Team;
import com.keystone.accessservice.domain.team.TeamFilter;
import com.keystone.accessservice.domain.team.TeamRepository;
import com.keystone.database.OrgFilterSql;
import com.keystone.security.ConflictException;
import com.keystone.security.OrgFilter;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** {@link TeamRepository} on the {@code teams} table. */
@Repository
public class JdbcTeamRepository implements TeamRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTeamRepository.class);

    private static final String COLUMNS = "id, organization_id, parent_team_id, name, slug, description, "
            + "team_type, visibility, status, max_members, created_by, created_at, updated_at";

    private final JdbcTemplate jdbc;

    public JdbcTeamRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void insert(Team team) {
        try {
            jdbc.update("INSERT INTO teams (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    team.id(),
                    team.organizationId(),
                    team.parentTeamId(),
                    team.name(),
                    team.slug(),
                    team.description(),
                    TeamStorageCodes.TYPES.encode(team.type()),
                    TeamStorageCodes.VISIBILITIES.encode(team.visibility()),
                    TeamStorageCodes.STATUSES.encode(team.status()),
                    team.maxMembers(),
                    team.creatorId(),
                    utc(team.createdAt()),
                    utc(team.updatedAt()));
        } catch (DuplicateKeyException e) {
            log.debug("Duplicate team slug: org={}, slug={}", team.organizationId(), team.slug(), e);
            throw new ConflictException("Team with slug '" + team.slug() + "' already exists");
        }
    }

    @Override
    public Optional<Team> findById(String id, OrgFilter scope) {
        return findOne("id = ?", id, scope);
    }

    @Override
    public Optional<Team> findBySlug(String slug, OrgFilter scope) {
        return findOne("slug = ?", slug, scope);
    }

    @Override
    public List<Team> find(TeamFilter filter, OrgFilter scope, int offset, int limit) {
        List<Object> args = new ArrayList<>();
        String where = where(filter, scope, args);
        args.add(limit);
        args.add(offset);
        return jdbc.query("SELECT " + COLUMNS + " FROM teams" + where + " ORDER BY name, id LIMIT ? OFFSET ?",
                this::mapTeam, args.toArray());
    }

    @Override
    public long count(TeamFilter filter, OrgFilter scope) {
        List<Object> args = new ArrayList<>();
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM teams" + where(filter, scope, args),
                Long.class, args.toArray());
        return count == null ? 0 : count;
    }

    private Optional<Team> findOne(String condition, String value, OrgFilter scope) {
        List<Object> args = new ArrayList<>();
        args.add(value);
        String where = " WHERE deleted_at IS NULL AND " + condition
                + OrgFilterSql.condition(scope, "organization_id", args).map(c -> " AND " + c).orElse("");
        return jdbc.query("SELECT " + COLUMNS + " FROM teams" + where, this::mapTeam, args.toArray())
                .stream()
                .findFirst();
    }

    private static String where(TeamFilter filter, OrgFilter scope, List<Object> args) {
        List<String> conditions = new ArrayList<>();
        conditions.add("deleted_at IS NULL");
        OrgFilterSql.condition(scope, "organization_id", args).ifPresent(conditions::add);
        if (filter.type() != null) {
            conditions.add("team_type = ?");
            args.add(TeamStorageCodes.TYPES.encode(filter.type()));
        }
        if (filter.status() != null) {
            conditions.add("status = ?");
            args.add(TeamStorageCodes.STATUSES.encode(filter.status()));
        }
        if (filter.visibility() != null) {
            conditions.add("visibility = ?");
            args.add(TeamStorageCodes.VISIBILITIES.encode(filter.visibility()));
        }
        if (filter.parentTeamId() != null) {
            conditions.add("parent_team_id = ?");
            args.add(filter.parentTeamId());
        }
        if (filter.search() != null) {
            String pattern = "%" + filter.search().toLowerCase(Locale.ROOT) + "%";
            conditions.add("(LOWER(name) LIKE ? OR LOWER(description) LIKE ?)");
            args.add(pattern);
            args.add(pattern);
        }
        return " WHERE " + String.join(" AND ", conditions);
    }

    private Team mapTeam(ResultSet rs, int rowNum) throws SQLException {
        return new Team(
                rs.getString("id"),
                rs.getString("organization_id"),
                rs.getString("parent_team_id"),
                rs.getString("name"),
                rs.getString("slug"),
                rs.getString("description"),
                TeamStorageCodes.TYPES.decode(rs.getString("team_type")),
                TeamStorageCodes.VISIBILITIES.decode(rs.getString("visibility")),
                TeamStorageCodes.STATUSES.decode(rs.getString("status")),
                rs.getObject("max_members", Integer.class),
                rs.getString("created_by"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}

package com.keystone.accessservice.domain.team;

import com.keystone.audit.AuditEvent;
import com.keystone.audit.AuditEventType;
import com.keystone.audit.AuditLedger;
import com.keystone.security.ConflictException;
import com.keystone.security.OrgFilter;
import com.keystone.security.OrgScopedQuery;
import com.keystone.security.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Team operations under tenant isolation. Reads are filtered by the caller's
 * {@link OrgScopedQuery}; teams outside that filter do not exist for the caller.
 */
@Service
public class TeamService {

    private static final Logger log = LoggerFactory.getLogger(TeamService.class);

    static final String RESOURCE_TYPE = "team";

    private final TeamRepository teams;
    private final AuditLedger auditLedger;
    private final Clock clock;
    private final TransactionOperations transactions;

    public TeamService(TeamRepository teams, AuditLedger auditLedger, Clock clock, TransactionOperations transactions) {
        this.teams = teams;
        this.auditLedger = auditLedger;
        this.clock = clock;
        this.transactions = transactions;
    }

    /**
     * @param page     1-based page number
     * @param pageSize teams per page
     */
    public TeamPage list(OrgScopedQuery scoped, TeamFilter filter, int page, int pageSize) {
        OrgFilter scope = scoped.filterFor(Team.class);
        long total = teams.count(filter, scope);
        long offset = (long) (page - 1) * pageSize;
        if (offset >= total) {
            return new TeamPage(List.of(), total, page, pageSize);
        }
        return new TeamPage(teams.find(filter, scope, (int) offset, pageSize), total, page, pageSize);
    }

    /**
     * @throws ResourceNotFoundException if the team does not exist or is not visible to the caller
     */
    public Team get(OrgScopedQuery scoped, String teamId) {
        Team team = teams.findById(teamId, scoped.filterFor(Team.class))
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, teamId));
        scoped.checkResource(team).orElseThrow();
        return team;
    }

    /**
     * Creates a team in the caller's organization and records a {@code team.created} event. The row
     * and its audit record commit together.
     *
     * @throws com.keystone.security.TenantRequiredException if the caller has no organization
     * @throws ConflictException                             if the slug is taken in the organization
     * @throws ResourceNotFoundException                     if the parent team is not visible
     */
    public Team create(OrgScopedQuery scoped, CreateTeamRequest request) {
        String organizationId = scoped.validateInsert(null, true);
        Team team = transactions.execute(status -> insertAudited(scoped, organizationId, request));
        log.info("Team created: id={}, slug={}, org={}", team.id(), team.slug(), organizationId);
        return team;
    }

    private Team insertAudited(OrgScopedQuery scoped, String organizationId, CreateTeamRequest request) {
        if (teams.findBySlug(request.slug(), OrgFilter.organization(organizationId, false)).isPresent()) {
            throw new ConflictException("Team with slug '" + request.slug() + "' already exists");
        }
        if (request.parentTeamId() != null) {
            get(scoped, request.parentTeamId());
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Team team = new Team(
                UUID.randomUUID().toString(),
                organizationId,
                request.parentTeamId(),
                request.name().strip(),
                request.slug(),
                request.description(),
                request.type(),
                request.visibility(),
                TeamStatus.ACTIVE,
                request.maxMembers(),
                scoped.principal().subjectId(),
                now,
                now);
        teams.insert(team);

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("name", team.name());
        changes.put("slug", team.slug());
        changes.put("team_type", team.type().value());
        changes.put("visibility", team.visibility().value());
        auditLedger.append(AuditEvent.teamAction(
                AuditEventType.TEAM_CREATED, scoped.principal(), organizationId, team.id(), team.name(),
                changes, "Team '" + team.name() + "' created"));
        return team;
    }
}

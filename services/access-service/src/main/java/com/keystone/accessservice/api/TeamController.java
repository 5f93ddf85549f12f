package com.keystone.accessservice.api;

import com.keystone.accessservice.domain.team.CreateTeamRequest;
import com.keystone.accessservice.domain.team.Team;
import com.keystone.accessservice.domain.team.TeamFilter;
import com.keystone.accessservice.domain.team.TeamPage;
import com.keystone.accessservice.domain.team.TeamService;
import com.keystone.accessservice.domain.team.TeamStatus;
import com.keystone.accessservice.domain.team.TeamType;
import com.keystone.accessservice.domain.team.TeamVisibility;
import com.keystone.accessservice.infrastructure.web.BearerAuthenticationFilter;
import com.keystone.security.OrgScopedQuery;
import com.keystone.security.Permissions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/teams")
public class TeamController {

    private final TeamService teamService;
    private final PermissionGuard guard;

    public TeamController(TeamService teamService, PermissionGuard guard) {
        this.teamService = teamService;
        this.guard = guard;
    }

    @GetMapping
    public PageResponse<Team> list(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String visibility,
            @RequestParam(required = false) @Size(max = TeamFilter.MAX_SEARCH_LENGTH) String search,
            @RequestParam(required = false) String parentTeamId,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int pageSize) {
        guard.require(scoped, "team", Permissions.READ_TEAMS);
        TeamFilter filter = new TeamFilter(
                QueryParameters.optional("type", type, TeamType::fromValue),
                QueryParameters.optional("status", status, TeamStatus::fromValue),
                QueryParameters.optional("visibility", visibility, TeamVisibility::fromValue),
                search,
                parentTeamId);
        TeamPage result = teamService.list(scoped, filter, page, pageSize);
        return PageResponse.of(result.teams(), result.page(), result.pageSize(), result.total());
    }

    @GetMapping("/{teamId}")
    public Team get(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @PathVariable String teamId) {
        guard.require(scoped, "team", Permissions.READ_TEAMS);
        return teamService.get(scoped, teamId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Team create(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @Valid @RequestBody CreateTeamRequest request) {
        guard.require(scoped, "team", Permissions.WRITE_TEAMS);
        return teamService.create(scoped, request);
    }
}

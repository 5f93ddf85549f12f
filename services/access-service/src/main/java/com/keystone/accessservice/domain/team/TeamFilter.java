package com.keystone.accessservice.domain.team;

/**
 * Optional criteria for listing teams. Null fields do not restrict.
 *
 * @param type         exact team type
 * @param status       exact status
 * @param visibility   exact visibility
 * @param search       case-insensitive substring of name or description
 * @param parentTeamId direct children of this team
 */
public record TeamFilter(
        TeamType type, TeamStatus status, TeamVisibility visibility, String search, String parentTeamId) {

    public static final int MAX_SEARCH_LENGTH = 100;

    public TeamFilter {
        search = search == null || search.isBlank() ? null : search.strip();
        if (search != null && search.length() > MAX_SEARCH_LENGTH) {
            throw new IllegalArgumentException("search must be at most " + MAX_SEARCH_LENGTH + " characters");
        }
    }

    public static TeamFilter none() {
        return new TeamFilter(null, null, null, null, null);
    }
}

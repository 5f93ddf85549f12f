package com.keystone.accessservice.domain.team;

import java.util.List;

/**
 * One page of teams, ordered by name.
 *
 * @param teams    the page content
 * @param total    number of matching teams across all pages
 * @param page     1-based page number
 * @param pageSize requested page size
 */
public record TeamPage(List<Team> teams, long total, int page, int pageSize) {

    public TeamPage {
        teams = List.copyOf(teams);
    }
}

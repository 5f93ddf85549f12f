package com.keystone.accessservice.domain.team;

import com.keystone.security.OrgFilter;
import java.util.List;
import java.util.Optional;

/** Storage of teams. Every read is restricted by the caller's {@link OrgFilter}; deleted teams are never returned. */
public interface TeamRepository {

    /**
     * @throws com.keystone.security.ConflictException if the organization already has a team with
     *     the same slug
     */
    void insert(Team team);

    Optional<Team> findById(String id, OrgFilter scope);

    Optional<Team> findBySlug(String slug, OrgFilter scope);

    /** Matching teams ordered by name. */
    List<Team> find(TeamFilter filter, OrgFilter scope, int offset, int limit);

    long count(TeamFilter filter, OrgFilter scope);
}

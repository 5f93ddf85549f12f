package com.keystone.accessservice.infrastructure.persistence;

import com.keystone.accessservice.domain.team.TeamStatus;
import com.keystone.accessservice.domain.team.TeamType;
import com.keystone.accessservice.domain.team.TeamVisibility;
import com.keystone.database.StorageCodes;

/** Stored codes of the team enums in the {@code teams} table. */
final class TeamStorageCodes {

    static final StorageCodes<TeamType> TYPES = StorageCodes.builder(TeamType.class, 1)
            .map(TeamType.DEPARTMENT, "department")
            .map(TeamType.PROJECT, "project")
            .map(TeamType.FUNCTIONAL, "functional")
            .map(TeamType.CROSS_FUNCTIONAL, "cross_functional")
            .map(TeamType.TEMPORARY, "temporary")
            .build();

    static final StorageCodes<TeamVisibility> VISIBILITIES = StorageCodes.builder(TeamVisibility.class, 1)
            .map(TeamVisibility.PUBLIC, "public")
            .map(TeamVisibility.PRIVATE, "private")
            .map(TeamVisibility.HIDDEN, "hidden")
            .build();

    static final StorageCodes<TeamStatus> STATUSES = StorageCodes.builder(TeamStatus.class, 1)
            .map(TeamStatus.ACTIVE, "active")
            .map(TeamStatus.INACTIVE, "inactive")
            .map(TeamStatus.ARCHIVED, "archived")
            .build();

    private TeamStorageCodes() {
        // utility class
    }
}

package com.keystone.accessservice.domain.team;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Input for creating a team in the caller's organization.
 *
 * @param name         display name
 * @param slug         lowercase letters, digits and hyphens
 * @param description  optional free text
 * @param type         defaults to {@link TeamType#FUNCTIONAL}
 * @param visibility   defaults to {@link TeamVisibility#PRIVATE}
 * @param parentTeamId optional enclosing team, which must be visible to the caller
 * @param maxMembers   optional member limit
 */
public record CreateTeamRequest(
        @NotBlank @Size(max = 255) String name,
        @NotBlank @Size(max = 255) @Pattern(regexp = "^[a-z0-9-]+$") String slug,
        @Size(max = 1000) String description,
        TeamType type,
        TeamVisibility visibility,
        String parentTeamId,
        @Positive Integer maxMembers) {
}

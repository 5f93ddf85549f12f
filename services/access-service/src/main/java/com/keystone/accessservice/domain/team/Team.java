package com.keystone.accessservice.domain.team;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.keystone.security.OrganizationScoped;
import com.keystone.security.OwnedResource;
import java.time.Instant;
import java.util.Optional;

/**
 * A group of users inside an organization. Slugs are unique per organization.
 *
 * @param id             UUID
 * @param organizationId owning organization (null for a global team)
 * @param parentTeamId   enclosing team (nullable)
 * @param name           display name
 * @param slug           URL-safe identifier, unique within the organization
 * @param description    free text (nullable)
 * @param type           kind of team
 * @param visibility     who may discover the team
 * @param status         lifecycle status
 * @param maxMembers     member limit (null means unlimited)
 * @param creatorId      subject id of the user who created the team (nullable)
 * @param createdAt      creation time
 * @param updatedAt      last modification time
 */
public record Team(
        String id,
        String organizationId,
        String parentTeamId,
        String name,
        String slug,
        String description,
        TeamType type,
        TeamVisibility visibility,
        TeamStatus status,
        Integer maxMembers,
        String creatorId,
        Instant createdAt,
        Instant updatedAt)
        implements OrganizationScoped, OwnedResource {

    public Team {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug must not be null or blank");
        }
        type = type == null ? TeamType.FUNCTIONAL : type;
        visibility = visibility == null ? TeamVisibility.PRIVATE : visibility;
        status = status == null ? TeamStatus.ACTIVE : status;
    }

    @Override
    @JsonIgnore
    public Optional<String> organization() {
        return Optional.ofNullable(organizationId);
    }

    @Override
    @JsonIgnore
    public Optional<String> createdBy() {
        return Optional.ofNullable(creatorId);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == TeamStatus.ACTIVE;
    }
}

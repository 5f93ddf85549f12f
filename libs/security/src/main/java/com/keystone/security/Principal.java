package com.keystone.security;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The authenticated actor of one request, built from validated token claims.
 *
 * <p>Immutable and never persisted. The stored user entity is looked up separately by
 * {@link #subjectId()}. The raw token is retained for downstream correlation only and is excluded
 * from {@link #toString()}.
 *
 * @param subjectId      identity-provider subject ({@code sub}); empty when the token had none
 * @param email          email address (nullable)
 * @param emailVerified  whether the provider verified the email
 * @param displayName    full name (nullable)
 * @param nickname       nickname (nullable)
 * @param pictureUrl     avatar URL (nullable)
 * @param organizationId home organization (nullable, absent means no tenant affiliation)
 * @param permissions    granted permission names
 * @param roles          granted role names
 * @param appMetadata    provider-managed application metadata
 * @param userMetadata   user-editable metadata
 * @param rawToken       the bearer token this principal was extracted from
 */
public record Principal(
        String subjectId,
        String email,
        boolean emailVerified,
        String displayName,
        String nickname,
        String pictureUrl,
        String organizationId,
        Set<String> permissions,
        Set<String> roles,
        Map<String, Object> appMetadata,
        Map<String, Object> userMetadata,
        String rawToken) {

    /** Roles that make a principal a system administrator. */
    public static final Set<String> SYSTEM_ADMIN_ROLES = Set.of("system_admin", "super_admin");

    public Principal {
        subjectId = subjectId == null ? "" : subjectId;
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        appMetadata = copyOf(appMetadata);
        userMetadata = copyOf(userMetadata);
    }

    public boolean isSystemAdmin() {
        return roles.stream().anyMatch(SYSTEM_ADMIN_ROLES::contains);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    public boolean hasAnyPermission(String... required) {
        return Arrays.stream(required).anyMatch(permissions::contains);
    }

    public boolean hasAllPermissions(String... required) {
        return permissions.containsAll(Arrays.asList(required));
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    @Override
    public String toString() {
        return "Principal[subjectId=%s, organizationId=%s, roles=%s, permissions=%s]"
                .formatted(subjectId, organizationId, roles, permissions);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        // metadata values may legitimately be JSON null, which Map.copyOf rejects
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

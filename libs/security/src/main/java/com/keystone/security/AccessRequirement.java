package com.keystone.security;

import java.util.List;
import java.util.Set;

/**
 * Declarative requirement combining RBAC and ABAC.
 *
 * <p>Permissions and roles may each be required all-of or any-of. Policies are evaluated only when
 * a concrete resource is supplied, and all of them must pass.
 */
public record AccessRequirement(
        Set<String> permissions,
        boolean requireAllPermissions,
        Set<String> roles,
        boolean requireAllRoles,
        List<AbacPolicy> policies) {

    public AccessRequirement {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    public static AccessRequirement allOf(String... permissions) {
        return new AccessRequirement(Set.of(permissions), true, Set.of(), true, List.of());
    }

    public static AccessRequirement anyOf(String... permissions) {
        return new AccessRequirement(Set.of(permissions), false, Set.of(), true, List.of());
    }

    public AccessRequirement withRoles(boolean requireAll, String... requiredRoles) {
        return new AccessRequirement(permissions, requireAllPermissions, Set.of(requiredRoles), requireAll, policies);
    }

    public AccessRequirement withPolicies(AbacPolicy... abacPolicies) {
        return new AccessRequirement(permissions, requireAllPermissions, roles, requireAllRoles, List.of(abacPolicies));
    }
}

package com.keystone.security;

import java.util.Set;

/**
 * Result of an authorization check. Decision functions return this instead of throwing; callers
 * that need a hard stop use {@link #orElseThrow()}.
 *
 * @param granted            whether access is allowed
 * @param adminBypass        whether access was granted only because the principal is a system admin
 * @param reason             why access was denied (null when granted)
 * @param missingPermissions permissions the principal lacked
 * @param missingRoles       roles the principal lacked
 */
public record AccessDecision(
        boolean granted,
        boolean adminBypass,
        DenialReason reason,
        Set<String> missingPermissions,
        Set<String> missingRoles) {

    private static final AccessDecision GRANTED = new AccessDecision(true, false, null, Set.of(), Set.of());
    private static final AccessDecision BYPASS = new AccessDecision(true, true, null, Set.of(), Set.of());

    public AccessDecision {
        missingPermissions = missingPermissions == null ? Set.of() : Set.copyOf(missingPermissions);
        missingRoles = missingRoles == null ? Set.of() : Set.copyOf(missingRoles);
        if (granted == (reason != null)) {
            throw new IllegalArgumentException("a denial needs a reason and a grant must not have one");
        }
    }

    public static AccessDecision grant() {
        return GRANTED;
    }

    public static AccessDecision bypass() {
        return BYPASS;
    }

    public static AccessDecision deny(DenialReason reason) {
        return new AccessDecision(false, false, reason, Set.of(), Set.of());
    }

    public static AccessDecision missingPermissions(Set<String> missing) {
        return new AccessDecision(false, false, DenialReason.MISSING_PERMISSIONS, missing, Set.of());
    }

    public static AccessDecision missingRoles(Set<String> missing) {
        return new AccessDecision(false, false, DenialReason.MISSING_ROLES, Set.of(), missing);
    }

    public boolean denied() {
        return !granted;
    }

    /**
     * @throws ForbiddenException carrying the missing permissions and roles if access was denied
     */
    public void orElseThrow() {
        if (granted) {
            return;
        }
        ErrorCode code = reason == DenialReason.CROSS_ORGANIZATION ? ErrorCode.CROSS_ORG_ACCESS : ErrorCode.FORBIDDEN;
        throw new ForbiddenException(code, message(), missingPermissions, missingRoles);
    }

    private String message() {
        return switch (reason) {
            case MISSING_PERMISSIONS -> "Missing required permissions: " + missingPermissions;
            case MISSING_ROLES -> "Missing required roles: " + missingRoles;
            case POLICY_DENIED -> "Access denied by policy";
            case CROSS_ORGANIZATION -> "Access denied: resource belongs to a different organization";
        };
    }
}

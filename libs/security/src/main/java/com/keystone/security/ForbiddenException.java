package com.keystone.security;

import java.util.Set;

/**
 * The authenticated principal may not perform the requested operation.
 *
 * <p>Carries the permissions and roles that were missing (empty when the denial came from an
 * attribute policy or tenant rule) so denials are observable without parsing messages.
 */
public class ForbiddenException extends KeystoneException {

    private final Set<String> missingPermissions;
    private final Set<String> missingRoles;

    public ForbiddenException(String message) {
        this(ErrorCode.FORBIDDEN, message, Set.of(), Set.of());
    }

    public ForbiddenException(ErrorCode errorCode, String message) {
        this(errorCode, message, Set.of(), Set.of());
    }

    public ForbiddenException(
            ErrorCode errorCode, String message, Set<String> missingPermissions, Set<String> missingRoles) {
        super(errorCode, message);
        this.missingPermissions = Set.copyOf(missingPermissions);
        this.missingRoles = Set.copyOf(missingRoles);
    }

    public Set<String> missingPermissions() {
        return missingPermissions;
    }

    public Set<String> missingRoles() {
        return missingRoles;
    }
}

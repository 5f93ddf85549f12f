package com.keystone.security;

/**
 * Permission names issued by the identity provider.
 *
 * <p>Format is {@code action:resource}. Roles are provider-side bundles of these.
 */
public final class Permissions {

    public static final String READ_USERS = "read:users";
    public static final String WRITE_USERS = "write:users";
    public static final String DELETE_USERS = "delete:users";
    public static final String MANAGE_USER_ROLES = "manage:user_roles";

    public static final String READ_TEAMS = "read:teams";
    public static final String WRITE_TEAMS = "write:teams";
    public static final String DELETE_TEAMS = "delete:teams";
    public static final String MANAGE_TEAM_MEMBERS = "manage:team_members";

    public static final String READ_ORGANIZATIONS = "read:organizations";
    public static final String WRITE_ORGANIZATIONS = "write:organizations";
    public static final String DELETE_ORGANIZATIONS = "delete:organizations";

    public static final String READ_AUDIT_LOGS = "read:audit_logs";
    public static final String EXPORT_AUDIT_LOGS = "export:audit_logs";

    public static final String READ_COMPLIANCE = "read:compliance";
    public static final String GENERATE_REPORTS = "generate:reports";
    public static final String EXPORT_REPORTS = "export:reports";

    public static final String ADMIN_ACCESS = "admin:access";
    public static final String SYSTEM_ADMIN = "system:admin";

    private Permissions() {
        // constants
    }
}

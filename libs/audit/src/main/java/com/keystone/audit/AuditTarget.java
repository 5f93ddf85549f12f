package com.keystone.audit;

/** The resource affected by an audited action. */
public record AuditTarget(String type, String id, String name) {

    public static final AuditTarget NONE = new AuditTarget(null, null, null);

    public static AuditTarget user(String userId, String email) {
        return new AuditTarget("user", userId, email);
    }

    public static AuditTarget team(String teamId, String name) {
        return new AuditTarget("team", teamId, name);
    }
}

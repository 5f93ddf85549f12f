package com.keystone.database.audit;

import com.keystone.audit.AuditEventType;
import com.keystone.audit.AuditOutcome;
import com.keystone.audit.AuditSeverity;
import com.keystone.database.StorageCodes;

/** Stored codes of the audit enums. */
public final class AuditStorageCodes {

    public static final StorageCodes<AuditEventType> EVENT_TYPES = StorageCodes.builder(AuditEventType.class, 1)
            .map(AuditEventType.AUTH_LOGIN_SUCCESS, "auth.login.success")
            .map(AuditEventType.AUTH_LOGIN_FAILED, "auth.login.failed")
            .map(AuditEventType.AUTH_LOGOUT, "auth.logout")
            .map(AuditEventType.AUTH_MFA_ENROLLED, "auth.mfa.enrolled")
            .map(AuditEventType.AUTH_MFA_CHALLENGE, "auth.mfa.challenge")
            .map(AuditEventType.AUTH_PASSWORD_RESET, "auth.password.reset")
            .map(AuditEventType.AUTH_PASSWORD_CHANGED, "auth.password.changed")
            .map(AuditEventType.USER_CREATED, "user.created")
            .map(AuditEventType.USER_UPDATED, "user.updated")
            .map(AuditEventType.USER_DELETED, "user.deleted")
            .map(AuditEventType.USER_BLOCKED, "user.blocked")
            .map(AuditEventType.USER_UNBLOCKED, "user.unblocked")
            .map(AuditEventType.ROLE_ASSIGNED, "role.assigned")
            .map(AuditEventType.ROLE_REMOVED, "role.removed")
            .map(AuditEventType.TEAM_CREATED, "team.created")
            .map(AuditEventType.TEAM_UPDATED, "team.updated")
            .map(AuditEventType.TEAM_DELETED, "team.deleted")
            .map(AuditEventType.TEAM_MEMBER_ADDED, "team.member.added")
            .map(AuditEventType.TEAM_MEMBER_REMOVED, "team.member.removed")
            .map(AuditEventType.ORG_CREATED, "org.created")
            .map(AuditEventType.ORG_UPDATED, "org.updated")
            .map(AuditEventType.ORG_DELETED, "org.deleted")
            .map(AuditEventType.ACCESS_DENIED, "access.denied")
            .map(AuditEventType.ACCESS_GRANTED, "access.granted")
            .map(AuditEventType.COMPLIANCE_REPORT_GENERATED, "compliance.report.generated")
            .map(AuditEventType.COMPLIANCE_EXPORT, "compliance.export")
            .map(AuditEventType.ADMIN_OVERRIDE, "admin.override")
            .map(AuditEventType.ADMIN_CONFIG_CHANGED, "admin.config.changed")
            .map(AuditEventType.SYSTEM_ERROR, "system.error")
            .map(AuditEventType.SYSTEM_STARTUP, "system.startup")
            .map(AuditEventType.SYSTEM_SHUTDOWN, "system.shutdown")
            .build();

    public static final StorageCodes<AuditSeverity> SEVERITIES = StorageCodes.builder(AuditSeverity.class, 1)
            .map(AuditSeverity.DEBUG, "debug")
            .map(AuditSeverity.INFO, "info")
            .map(AuditSeverity.NOTICE, "notice")
            .map(AuditSeverity.WARNING, "warning")
            .map(AuditSeverity.ERROR, "error")
            .map(AuditSeverity.CRITICAL, "critical")
            .map(AuditSeverity.ALERT, "alert")
            .build();

    public static final StorageCodes<AuditOutcome> OUTCOMES = StorageCodes.builder(AuditOutcome.class, 1)
            .map(AuditOutcome.SUCCESS, "success")
            .map(AuditOutcome.FAILURE, "failure")
            .map(AuditOutcome.UNKNOWN, "unknown")
            .build();

    private AuditStorageCodes() {
        // utility class
    }
}

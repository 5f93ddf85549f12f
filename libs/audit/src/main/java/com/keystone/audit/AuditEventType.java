package com.keystone.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of auditable events. The dotted value is what appears in API responses, hash input
 * and the control catalog; its prefix before the first dot is the event category.
 */
public enum AuditEventType {
    AUTH_LOGIN_SUCCESS("auth.login.success"),
    AUTH_LOGIN_FAILED("auth.login.failed"),
    AUTH_LOGOUT("auth.logout"),
    AUTH_MFA_ENROLLED("auth.mfa.enrolled"),
    AUTH_MFA_CHALLENGE("auth.mfa.challenge"),
    AUTH_PASSWORD_RESET("auth.password.reset"),
    AUTH_PASSWORD_CHANGED("auth.password.changed"),

    USER_CREATED("user.created"),
    USER_UPDATED("user.updated"),
    USER_DELETED("user.deleted"),
    USER_BLOCKED("user.blocked"),
    USER_UNBLOCKED("user.unblocked"),

    ROLE_ASSIGNED("role.assigned"),
    ROLE_REMOVED("role.removed"),

    TEAM_CREATED("team.created"),
    TEAM_UPDATED("team.updated"),
    TEAM_DELETED("team.deleted"),
    TEAM_MEMBER_ADDED("team.member.added"),
    TEAM_MEMBER_REMOVED("team.member.removed"),

    ORG_CREATED("org.created"),
    ORG_UPDATED("org.updated"),
    ORG_DELETED("org.deleted"),

    ACCESS_DENIED("access.denied"),
    ACCESS_GRANTED("access.granted"),

    COMPLIANCE_REPORT_GENERATED("compliance.report.generated"),
    COMPLIANCE_EXPORT("compliance.export"),

    ADMIN_OVERRIDE("admin.override"),
    ADMIN_CONFIG_CHANGED("admin.config.changed"),

    SYSTEM_ERROR("system.error"),
    SYSTEM_STARTUP("system.startup"),
    SYSTEM_SHUTDOWN("system.shutdown");

    /** Categories whose events are security relevant regardless of severity. */
    public static final Set<String> SECURITY_CATEGORIES = Set.of("auth", "access", "admin");

    private static final Map<String, AuditEventType> BY_VALUE =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(AuditEventType::value, Function.identity()));

    private final String value;

    AuditEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String category() {
        return value.substring(0, value.indexOf('.'));
    }

    /**
     * @throws IllegalArgumentException for an unknown value
     */
    @JsonCreator
    public static AuditEventType fromValue(String value) {
        AuditEventType type = BY_VALUE.get(value);
        if (type == null) {
            throw new IllegalArgumentException("Unknown audit event type: " + value);
        }
        return type;
    }

    /** All event types whose category is one of {@code categories}. */
    public static Set<AuditEventType> inCategories(Set<String> categories) {
        Set<AuditEventType> result = EnumSet.noneOf(AuditEventType.class);
        for (AuditEventType type : values()) {
            if (categories.contains(type.category())) {
                result.add(type);
            }
        }
        return result;
    }
}

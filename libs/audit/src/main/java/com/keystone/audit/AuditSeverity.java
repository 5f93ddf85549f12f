package com.keystone.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

public enum AuditSeverity {
    DEBUG("debug"),
    INFO("info"),
    NOTICE("notice"),
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical"),
    ALERT("alert");

    /** Severities counted as high in summaries and security views. */
    public static final Set<AuditSeverity> HIGH = EnumSet.of(ERROR, CRITICAL, ALERT);

    private final String value;

    AuditSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @throws IllegalArgumentException for an unknown value
     */
    @JsonCreator
    public static AuditSeverity fromValue(String value) {
        for (AuditSeverity candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown audit severity: " + value);
    }

    public boolean isHigh() {
        return HIGH.contains(this);
    }
}

package com.keystone.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditOutcome {
    SUCCESS("success"),
    FAILURE("failure"),
    UNKNOWN("unknown");

    private final String value;

    AuditOutcome(String value) {
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
    public static AuditOutcome fromValue(String value) {
        for (AuditOutcome candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown audit outcome: " + value);
    }
}

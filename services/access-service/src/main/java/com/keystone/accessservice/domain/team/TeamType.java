package com.keystone.accessservice.domain.team;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kind of team. */
public enum TeamType {
    DEPARTMENT("department"),
    PROJECT("project"),
    FUNCTIONAL("functional"),
    CROSS_FUNCTIONAL("cross_functional"),
    TEMPORARY("temporary");

    private final String value;

    TeamType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TeamType fromValue(String value) {
        String normalized = value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
        for (TeamType candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown team type: " + value);
    }
}

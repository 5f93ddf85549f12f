package com.keystone.accessservice.domain.team;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Who may discover a team. */
public enum TeamVisibility {
    PUBLIC("public"),
    PRIVATE("private"),
    HIDDEN("hidden");

    private final String value;

    TeamVisibility(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TeamVisibility fromValue(String value) {
        String normalized = value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
        for (TeamVisibility candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown team visibility: " + value);
    }
}

package com.keystone.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

/** Audit readiness band for a compliance score. */
public enum Readiness {
    AUDIT_READY("Audit Ready", "green", 90),
    NEARLY_READY("Nearly Ready", "yellow", 70),
    NEEDS_WORK("Needs Work", "orange", 50),
    NOT_READY("Not Ready", "red", 0);

    private final String label;
    private final String color;
    private final double minimumScore;

    Readiness(String label, String color, double minimumScore) {
        this.label = label;
        this.color = color;
        this.minimumScore = minimumScore;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String color() {
        return color;
    }

    public static Readiness of(double score) {
        for (Readiness band : values()) {
            if (score >= band.minimumScore) {
                return band;
            }
        }
        return NOT_READY;
    }
}

package com.keystone.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

/** Evaluation result of one control, with its weight in the overall score. */
public enum ControlStatus {
    COMPLIANT("compliant", 1.0),
    PARTIAL("partial", 0.5),
    PENDING_REVIEW("pending_review", 0.25),
    NON_COMPLIANT("non_compliant", 0.0),
    /** Excluded from scoring. */
    NOT_APPLICABLE("not_applicable", Double.NaN);

    static final long COMPLIANT_THRESHOLD = 100;
    static final long PARTIAL_THRESHOLD = 10;

    private final String value;
    private final double weight;

    ControlStatus(String value, double weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public double weight() {
        return weight;
    }

    public boolean scored() {
        return this != NOT_APPLICABLE;
    }

    /**
     * Status for a control with the given evidence. Controls without mapped event types are never
     * assessed and are always {@link #NOT_APPLICABLE}.
     */
    public static ControlStatus fromEvidence(boolean instrumented, long evidenceCount) {
        if (!instrumented) {
            return NOT_APPLICABLE;
        }
        if (evidenceCount >= COMPLIANT_THRESHOLD) {
            return COMPLIANT;
        }
        if (evidenceCount >= PARTIAL_THRESHOLD) {
            return PARTIAL;
        }
        if (evidenceCount > 0) {
            return PENDING_REVIEW;
        }
        return NOT_APPLICABLE;
    }
}

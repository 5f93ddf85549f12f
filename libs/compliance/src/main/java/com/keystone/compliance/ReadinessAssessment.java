package com.keystone.compliance;

import java.time.Instant;

/**
 * Readiness over the trailing assessment window.
 *
 * @param needsAttention controls that are partial or non-compliant
 */
public record ReadinessAssessment(
        ComplianceFramework framework,
        double score,
        Readiness readiness,
        Instant evaluatedAt,
        long periodDays,
        int totalControls,
        long compliant,
        long needsAttention) {

    public String readinessColor() {
        return readiness.color();
    }
}

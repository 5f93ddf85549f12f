package com.keystone.compliance;

import java.time.Instant;

/** One evaluated control within a report. */
public record ControlAssessment(
        String categoryId,
        String categoryName,
        String controlId,
        String controlName,
        String description,
        ControlStatus status,
        long evidenceCount,
        Instant lastEvaluated) {}

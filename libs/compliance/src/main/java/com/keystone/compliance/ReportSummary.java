package com.keystone.compliance;

import java.util.List;

/** Control counts by status together with the overall score. */
public record ReportSummary(
        double overallScore,
        int totalControls,
        long compliant,
        long nonCompliant,
        long partial,
        long pendingReview,
        long notApplicable) {

    public static ReportSummary of(double score, List<ControlAssessment> controls) {
        return new ReportSummary(
                score,
                controls.size(),
                count(controls, ControlStatus.COMPLIANT),
                count(controls, ControlStatus.NON_COMPLIANT),
                count(controls, ControlStatus.PARTIAL),
                count(controls, ControlStatus.PENDING_REVIEW),
                count(controls, ControlStatus.NOT_APPLICABLE));
    }

    private static long count(List<ControlAssessment> controls, ControlStatus status) {
        return controls.stream().filter(c -> c.status() == status).count();
    }
}

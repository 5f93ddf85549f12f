package com.keystone.compliance;

import java.time.Instant;
import java.util.List;

/**
 * A generated compliance report. Reports are computed on demand and not stored; generation is
 * recorded in the audit ledger.
 *
 * @param organizationId the reported organization, null for an unrestricted report
 */
public record ComplianceReport(
        String id,
        ComplianceFramework framework,
        String organizationId,
        Instant generatedAt,
        String generatedBy,
        Instant periodStart,
        Instant periodEnd,
        ReportSummary summary,
        EvidenceSummary auditSummary,
        UserStatistics userStatistics,
        List<ControlAssessment> controls,
        List<Recommendation> recommendations) {

    public ComplianceReport {
        controls = List.copyOf(controls);
        recommendations = List.copyOf(recommendations);
    }
}

package com.keystone.compliance;

import com.keystone.audit.AuditActor;
import com.keystone.audit.AuditEvent;
import com.keystone.audit.AuditEventType;
import com.keystone.audit.AuditLedger;
import com.keystone.audit.AuditQuery;
import com.keystone.audit.AuditTarget;
import com.keystone.security.OrgFilter;
import com.keystone.security.Principal;
import com.keystone.security.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates framework controls against audit evidence.
 *
 * <p>A control's status comes from the number of audit records of its evidence event types inside
 * the evaluation window. The overall score is the mean status weight of all assessed controls;
 * not-applicable controls are excluded, a catalog whose controls are all not applicable scores 100
 * and a framework without controls scores 0.
 */
public final class ComplianceScorer {

    private static final Logger log = LoggerFactory.getLogger(ComplianceScorer.class);

    public static final Duration DEFAULT_PERIOD = Duration.ofDays(90);
    public static final Duration READINESS_PERIOD = Duration.ofDays(90);

    private static final Set<AuditEventType> SECURITY_EVIDENCE =
            AuditEventType.inCategories(Set.of("auth", "access"));

    private final AuditLedger ledger;
    private final ControlCatalog catalog;
    private final UserDirectory users;
    private final Clock clock;

    public ComplianceScorer(AuditLedger ledger, ControlCatalog catalog, UserDirectory users, Clock clock) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger must not be null");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        this.ledger = ledger;
        this.catalog = catalog;
        this.users = users == null ? scope -> UserStatistics.empty() : users;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /** Assesses every control of {@code framework} over {@code [from, to]}. */
    public List<ControlAssessment> evaluate(ComplianceFramework framework, OrgFilter scope, Instant from, Instant to) {
        Instant evaluatedAt = clock.instant();
        List<ControlAssessment> result = new ArrayList<>();
        for (ControlCategory category : catalog.categories(framework)) {
            for (ControlDefinition control : category.controls()) {
                long evidence = ledger.countEvidence(scope, control.evidence(), from, to);
                result.add(new ControlAssessment(
                        category.id(),
                        category.name(),
                        control.id(),
                        control.name(),
                        control.description(),
                        ControlStatus.fromEvidence(control.instrumented(), evidence),
                        evidence,
                        evaluatedAt));
            }
        }
        return result;
    }

    /** Overall score in {@code [0, 100]}, rounded to two decimals. */
    public static double score(List<ControlAssessment> controls) {
        if (controls.isEmpty()) {
            return 0.0;
        }
        int assessed = 0;
        double total = 0.0;
        for (ControlAssessment control : controls) {
            if (control.status().scored()) {
                assessed++;
                total += control.status().weight();
            }
        }
        if (assessed == 0) {
            return 100.0;
        }
        return BigDecimal.valueOf(total / assessed * 100).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /** Recommendations for every control that is not fully compliant, highest priority first. */
    public static List<Recommendation> recommendations(List<ControlAssessment> controls) {
        return controls.stream()
                .map(Recommendation::forControl)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(Recommendation::priority))
                .toList();
    }

    /**
     * Builds a full report and records its generation in the audit ledger.
     *
     * @param from period start; defaults to {@link #DEFAULT_PERIOD} before {@code to}
     * @param to   period end; defaults to now
     */
    public ComplianceReport generateReport(
            ComplianceFramework framework, OrgFilter scope, Principal actor, Instant from, Instant to) {
        Instant end = to == null ? clock.instant() : to;
        Instant start = from == null ? end.minus(DEFAULT_PERIOD) : from;
        if (start.isAfter(end)) {
            throw new ValidationException("Report period start must not be after its end");
        }

        String reportId = UUID.randomUUID().toString();
        List<ControlAssessment> controls = evaluate(framework, scope, start, end);
        double score = score(controls);

        ComplianceReport report = new ComplianceReport(
                reportId,
                framework,
                scope.organizationId(),
                clock.instant(),
                actor.subjectId(),
                start,
                end,
                ReportSummary.of(score, controls),
                evidenceSummary(scope, start, end),
                users.statistics(scope),
                controls,
                recommendations(controls));

        ledger.append(new AuditEvent(
                AuditEventType.COMPLIANCE_REPORT_GENERATED,
                null,
                null,
                AuditActor.of(actor),
                new AuditTarget("compliance_report", reportId, null),
                scope.organizationId(),
                "Generated " + framework.id() + " compliance report",
                null,
                Map.of("framework", framework.id(), "period_days", Duration.between(start, end).toDays()),
                null, null, null, null));

        log.info("Compliance report generated: reportId={}, framework={}, org={}, score={}",
                reportId, framework.id(), scope.organizationId(), score);
        return report;
    }

    /** Scores the trailing {@link #READINESS_PERIOD} and bands the result. */
    public ReadinessAssessment assessReadiness(ComplianceFramework framework, OrgFilter scope) {
        Instant end = clock.instant();
        List<ControlAssessment> controls = evaluate(framework, scope, end.minus(READINESS_PERIOD), end);
        double score = score(controls);
        long compliant = controls.stream().filter(c -> c.status() == ControlStatus.COMPLIANT).count();
        long needsAttention = controls.stream()
                .filter(c -> c.status() == ControlStatus.NON_COMPLIANT || c.status() == ControlStatus.PARTIAL)
                .count();
        return new ReadinessAssessment(
                framework,
                score,
                Readiness.of(score),
                end,
                READINESS_PERIOD.toDays(),
                controls.size(),
                compliant,
                needsAttention);
    }

    public List<ControlCategory> controls(ComplianceFramework framework) {
        return catalog.categories(framework);
    }

    private EvidenceSummary evidenceSummary(OrgFilter scope, Instant from, Instant to) {
        AuditQuery period = AuditQuery.scoped(scope).between(from, to);
        return new EvidenceSummary(
                ledger.count(period),
                ledger.countEvidence(scope, SECURITY_EVIDENCE, from, to),
                ledger.countEvidence(scope, Set.of(AuditEventType.AUTH_LOGIN_FAILED), from, to),
                ledger.countEvidence(scope, Set.of(AuditEventType.ACCESS_DENIED), from, to));
    }
}

package com.keystone.accessservice.api;

import com.keystone.accessservice.infrastructure.web.BearerAuthenticationFilter;
import com.keystone.audit.AuditEventType;
import com.keystone.audit.AuditLedger;
import com.keystone.audit.AuditOutcome;
import com.keystone.audit.AuditPage;
import com.keystone.audit.AuditQuery;
import com.keystone.audit.AuditRecord;
import com.keystone.audit.AuditSeverity;
import com.keystone.audit.AuditSummary;
import com.keystone.audit.ChainIntegrityReport;
import com.keystone.audit.ChainScope;
import com.keystone.security.OrgFilter;
import com.keystone.security.OrgScopedQuery;
import com.keystone.security.Permissions;
import com.keystone.security.ResourceNotFoundException;
import com.keystone.security.ValidationException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the caller's audit trail. Every query is restricted to the organization the
 * request acts on; integrity verification covers that organization's chain, or the global chain
 * for callers without one.
 */
@RestController
@RequestMapping("/api/v1/audit-logs")
public class AuditLogController {

    private static final String RESOURCE = "audit_log";

    private final AuditLedger ledger;
    private final PermissionGuard guard;

    public AuditLogController(AuditLedger ledger, PermissionGuard guard) {
        this.ledger = ledger;
        this.guard = guard;
    }

    @GetMapping
    public PageResponse<AuditRecord> list(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @RequestParam(required = false) String eventType,
            @RequestParam(required = false) String actorId,
            @RequestParam(required = false) String targetType,
            @RequestParam(required = false) String targetId,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String outcome,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(100) int pageSize) {
        guard.require(scoped, RESOURCE, Permissions.READ_AUDIT_LOGS);
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new ValidationException("startDate must not be after endDate");
        }

        AuditQuery query = AuditQuery.scoped(scope(scoped))
                .withActor(actorId)
                .withTarget(targetType, targetId)
                .withSeverity(QueryParameters.optional("severity", severity, AuditSeverity::fromValue))
                .withOutcome(QueryParameters.optional("outcome", outcome, AuditOutcome::fromValue))
                .between(startDate, endDate);
        if (eventType != null) {
            AuditEventType type = QueryParameters.optional("eventType", eventType, AuditEventType::fromValue);
            query = query.withEventTypes(Set.of(type));
        }

        AuditPage result = ledger.query(query, page, pageSize);
        return PageResponse.of(result.records(), result.page(), result.pageSize(), result.total());
    }

    @GetMapping("/summary")
    public AuditSummary summary(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @RequestParam(defaultValue = "7") @Min(1) @Max(90) int days) {
        guard.require(scoped, RESOURCE, Permissions.READ_AUDIT_LOGS);
        return ledger.summary(scope(scoped), Duration.ofDays(days));
    }

    @GetMapping("/security")
    public List<AuditRecord> securityEvents(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @RequestParam(defaultValue = "24") @Min(1) @Max(168) int hours,
            @RequestParam(defaultValue = "100") @Min(1) @Max(500) int limit) {
        guard.require(scoped, RESOURCE, Permissions.READ_AUDIT_LOGS);
        return ledger.securityEvents(scope(scoped), Duration.ofHours(hours), limit);
    }

    @GetMapping("/integrity")
    public ChainIntegrityReport integrity(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @RequestParam(defaultValue = "1000") @Min(100) @Max(10000) int limit) {
        guard.require(scoped, RESOURCE, Permissions.READ_AUDIT_LOGS);
        return ledger.verifyChain(ChainScope.of(scoped.context().orgId()), limit);
    }

    @GetMapping("/users/{userId}")
    public List<AuditRecord> userActivity(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @PathVariable String userId,
            @RequestParam(defaultValue = "100") @Min(1) @Max(500) int limit) {
        guard.require(scoped, RESOURCE, Permissions.READ_AUDIT_LOGS);
        return ledger.userActivity(userId, scope(scoped), limit);
    }

    @GetMapping("/{recordId}")
    public AuditRecord get(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @PathVariable String recordId) {
        guard.require(scoped, RESOURCE, Permissions.READ_AUDIT_LOGS);
        return ledger.findById(recordId, scope(scoped))
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, recordId));
    }

    private static OrgFilter scope(OrgScopedQuery scoped) {
        return scoped.filterFor(AuditRecord.class);
    }
}

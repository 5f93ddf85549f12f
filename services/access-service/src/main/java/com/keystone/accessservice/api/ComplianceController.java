package com.keystone.accessservice.api;

import com.keystone.accessservice.infrastructure.web.BearerAuthenticationFilter;
import com.keystone.audit.AuditRecord;
import com.keystone.compliance.ComplianceFramework;
import com.keystone.compliance.ComplianceReport;
import com.keystone.compliance.ComplianceScorer;
import com.keystone.compliance.ControlCategory;
import com.keystone.compliance.ReadinessAssessment;
import com.keystone.security.OrgScopedQuery;
import com.keystone.security.Permissions;
import com.keystone.security.ResourceNotFoundException;
import com.keystone.security.ValidationException;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Compliance frameworks, reports and readiness. Evidence is counted from the audit records visible
 * to the caller's organization.
 */
@RestController
@RequestMapping("/api/v1/compliance")
public class ComplianceController {

    private static final String RESOURCE = "compliance";

    private final ComplianceScorer scorer;
    private final PermissionGuard guard;

    public ComplianceController(ComplianceScorer scorer, PermissionGuard guard) {
        this.scorer = scorer;
        this.guard = guard;
    }

    @GetMapping("/frameworks")
    public List<FrameworkResponse> frameworks(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped) {
        guard.require(scoped, RESOURCE, Permissions.READ_COMPLIANCE);
        return Arrays.stream(ComplianceFramework.values())
                .map(f -> new FrameworkResponse(f.id(), f.displayName(), f.description()))
                .toList();
    }

    @GetMapping("/frameworks/{frameworkId}/controls")
    public FrameworkControls controls(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @PathVariable String frameworkId) {
        guard.require(scoped, RESOURCE, Permissions.READ_COMPLIANCE);
        ComplianceFramework framework = knownFramework(frameworkId);
        return new FrameworkControls(framework.id(), scorer.controls(framework));
    }

    @PostMapping("/reports")
    public ComplianceReport generateReport(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @Valid @RequestBody GenerateReportRequest request) {
        guard.require(scoped, RESOURCE, Permissions.GENERATE_REPORTS);
        ComplianceFramework framework;
        try {
            framework = ComplianceFramework.fromId(request.framework());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid framework '" + request.framework() + "'");
        }
        return scorer.generateReport(framework, scoped.filterFor(AuditRecord.class), scoped.principal(),
                request.startDate(), request.endDate());
    }

    @GetMapping("/readiness/{frameworkId}")
    public ReadinessAssessment readiness(
            @RequestAttribute(BearerAuthenticationFilter.SCOPED_QUERY_ATTRIBUTE) OrgScopedQuery scoped,
            @PathVariable String frameworkId) {
        guard.require(scoped, RESOURCE, Permissions.READ_COMPLIANCE);
        return scorer.assessReadiness(knownFramework(frameworkId), scoped.filterFor(AuditRecord.class));
    }

    private static ComplianceFramework knownFramework(String frameworkId) {
        try {
            return ComplianceFramework.fromId(frameworkId);
        } catch (IllegalArgumentException e) {
            throw new ResourceNotFoundException("framework", frameworkId);
        }
    }

    public record FrameworkResponse(String id, String name, String description) {
    }

    public record FrameworkControls(String framework, List<ControlCategory> categories) {
    }
}

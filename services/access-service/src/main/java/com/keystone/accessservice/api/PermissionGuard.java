package com.keystone.accessservice.api;

import com.keystone.audit.AuditEvent;
import com.keystone.audit.AuditLedger;
import com.keystone.security.AccessController;
import com.keystone.security.AccessDecision;
import com.keystone.security.OrgScopedQuery;
import com.keystone.security.Principal;
import java.util.Arrays;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Endpoint-level RBAC check. A denial is recorded as an {@code access.denied} audit event in the
 * caller's organization before it is raised.
 */
@Component
public class PermissionGuard {

    private final AccessController accessController;
    private final AuditLedger auditLedger;

    public PermissionGuard(AccessController accessController, AuditLedger auditLedger) {
        this.accessController = accessController;
        this.auditLedger = auditLedger;
    }

    /**
     * @param resourceType audited target type of the denied operation
     * @throws com.keystone.security.ForbiddenException if any permission is missing
     */
    public void require(OrgScopedQuery scoped, String resourceType, String... permissions) {
        Principal principal = scoped.principal();
        AccessDecision decision = accessController.checkPermissions(principal, Arrays.asList(permissions), true);
        if (decision.denied()) {
            auditLedger.append(AuditEvent.accessDenied(principal, scoped.context().orgId(), resourceType, null,
                    "Missing permissions " + new TreeSet<>(decision.missingPermissions())));
        }
        accessController.enforce(principal, decision);
    }
}

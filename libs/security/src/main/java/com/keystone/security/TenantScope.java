package com.keystone.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the organization a request acts on.
 *
 * <p>Without an override header the principal's own organization applies. The override header is a
 * privileged escalation: a system administrator switches to the named organization, anyone else is
 * rejected. Callers are responsible for auditing granted overrides.
 */
public final class TenantScope {

    private static final Logger log = LoggerFactory.getLogger(TenantScope.class);

    public static final String DEFAULT_OVERRIDE_HEADER = "X-Organization-Override";

    private TenantScope() {
        // utility class
    }

    /**
     * @param overrideHeaderValue value of the override header (null or blank means absent)
     * @throws ForbiddenException if a non-administrator supplies an override
     */
    public static OrgContext resolve(Principal principal, String overrideHeaderValue) {
        if (overrideHeaderValue == null || overrideHeaderValue.isBlank()) {
            return OrgContext.of(principal.organizationId());
        }
        String target = overrideHeaderValue.strip();
        if (!principal.isSystemAdmin()) {
            log.warn("Organization override denied: user={}, attemptedOrg={}", principal.subjectId(), target);
            throw new ForbiddenException("Organization override requires system admin privileges");
        }
        log.info("Organization override granted: user={}, originalOrg={}, overrideOrg={}",
                principal.subjectId(), principal.organizationId(), target);
        return OrgContext.overriding(target, principal.organizationId());
    }

    /**
     * @return the organization id of {@code context}
     * @throws TenantRequiredException if no organization was resolved
     */
    public static String require(OrgContext context) {
        if (context == null || !context.hasOrg()) {
            throw new TenantRequiredException("Organization context required for this operation");
        }
        return context.orgId();
    }

    public static OrgScopedQuery scopedQuery(Principal principal, OrgContext context) {
        return new OrgScopedQuery(principal, context);
    }
}

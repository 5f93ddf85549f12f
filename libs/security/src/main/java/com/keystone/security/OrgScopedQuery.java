package com.keystone.security;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tenant-isolation helper bound to one request's principal and {@link OrgContext}.
 *
 * <p>Produces read filters, validates inserts and checks single resources. Only a system
 * administrator in override mode may cross organizations.
 */
public final class OrgScopedQuery {

    private static final Logger log = LoggerFactory.getLogger(OrgScopedQuery.class);

    private final Principal principal;
    private final OrgContext context;

    public OrgScopedQuery(Principal principal, OrgContext context) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        this.principal = principal;
        this.context = context;
    }

    public OrgFilter filterFor(Class<?> entityType) {
        return filterFor(entityType, false);
    }

    /**
     * Builds the read filter for {@code entityType}. Types that do not implement
     * {@link OrganizationScoped} are global and unfiltered.
     *
     * @param includeGlobal also return rows without an organization
     */
    public OrgFilter filterFor(Class<?> entityType, boolean includeGlobal) {
        if (!OrganizationScoped.class.isAssignableFrom(entityType)) {
            return OrgFilter.unrestricted();
        }
        if (isOverridingAdmin()) {
            return context.hasOrg()
                    ? OrgFilter.organization(context.orgId(), includeGlobal)
                    : OrgFilter.unrestricted();
        }
        if (!context.hasOrg()) {
            return OrgFilter.globalOnly();
        }
        return OrgFilter.organization(context.orgId(), includeGlobal);
    }

    /**
     * Resolves the organization id to store on a new record.
     *
     * @param suppliedOrgId organization given by the caller (nullable)
     * @param requireOrg    whether the record must belong to an organization
     * @return the organization id to persist (null only when not required and none is resolved)
     * @throws ForbiddenException      if the supplied organization differs from the resolved one
     * @throws TenantRequiredException if an organization is required but none is available
     */
    public String validateInsert(String suppliedOrgId, boolean requireOrg) {
        if (suppliedOrgId != null) {
            if (!suppliedOrgId.equals(context.orgId()) && !isOverridingAdmin()) {
                log.warn("Cross-organization insert denied: user={}, contextOrg={}, suppliedOrg={}",
                        principal.subjectId(), context.orgId(), suppliedOrgId);
                throw new ForbiddenException(
                        ErrorCode.CROSS_ORG_ACCESS, "Cannot create resource in a different organization");
            }
            return suppliedOrgId;
        }
        if (context.hasOrg()) {
            return context.orgId();
        }
        if (requireOrg) {
            throw new TenantRequiredException("Organization context required to create resource");
        }
        return null;
    }

    /** Checks that a single resource is visible to this request. Global resources always pass. */
    public AccessDecision checkResource(OrganizationScoped resource) {
        if (isOverridingAdmin()) {
            return AccessDecision.bypass();
        }
        Optional<String> resourceOrg = resource.organization();
        if (resourceOrg.isEmpty() || resourceOrg.get().equals(context.orgId())) {
            return AccessDecision.grant();
        }
        log.warn("Cross-organization access denied: user={}, contextOrg={}, resourceOrg={}, type={}",
                principal.subjectId(), context.orgId(), resourceOrg.get(), resource.getClass().getSimpleName());
        return AccessDecision.deny(DenialReason.CROSS_ORGANIZATION);
    }

    public OrgContext context() {
        return context;
    }

    public Principal principal() {
        return principal;
    }

    private boolean isOverridingAdmin() {
        return principal.isSystemAdmin() && context.override();
    }
}

package com.keystone.security;

import java.util.Optional;

/**
 * Effective organization of one request.
 *
 * @param orgId         organization the request acts on (nullable)
 * @param override      whether a system administrator explicitly switched organization
 * @param originalOrgId the administrator's own organization, only set when overriding
 */
public record OrgContext(String orgId, boolean override, String originalOrgId) {

    public OrgContext {
        if (!override && originalOrgId != null) {
            throw new IllegalArgumentException("originalOrgId is only recorded when overriding");
        }
    }

    public static OrgContext of(String orgId) {
        return new OrgContext(orgId, false, null);
    }

    public static OrgContext overriding(String targetOrgId, String originalOrgId) {
        return new OrgContext(targetOrgId, true, originalOrgId);
    }

    public boolean hasOrg() {
        return orgId != null;
    }

    public Optional<String> organization() {
        return Optional.ofNullable(orgId);
    }
}

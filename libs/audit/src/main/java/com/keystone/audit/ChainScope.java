package com.keystone.audit;

import java.util.Optional;

/**
 * Identifies one hash chain: an organization's records, or the global chain of records without an
 * organization.
 *
 * @param organizationId the organization (null for the global chain)
 */
public record ChainScope(String organizationId) {

    private static final ChainScope GLOBAL = new ChainScope(null);

    public static ChainScope of(String organizationId) {
        return organizationId == null ? GLOBAL : new ChainScope(organizationId);
    }

    public static ChainScope global() {
        return GLOBAL;
    }

    public boolean isGlobal() {
        return organizationId == null;
    }

    public Optional<String> organization() {
        return Optional.ofNullable(organizationId);
    }

    /** Key used for the scope in storage; the global chain has a reserved key. */
    public String key() {
        return organizationId == null ? "__global__" : organizationId;
    }
}

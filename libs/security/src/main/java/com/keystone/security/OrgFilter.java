package com.keystone.security;

import java.util.Objects;

/**
 * Row filter derived from an {@link OrgContext} for entities carrying an organization id.
 *
 * @param mode           how rows are restricted
 * @param organizationId the organization rows must belong to ({@link Mode#ORGANIZATION} only)
 * @param includeGlobal  whether rows without an organization are also visible
 *                       ({@link Mode#ORGANIZATION} only)
 */
public record OrgFilter(Mode mode, String organizationId, boolean includeGlobal) {

    public enum Mode {
        /** No restriction. */
        UNRESTRICTED,
        /** Only rows without an organization. */
        GLOBAL_ONLY,
        /** Rows of {@code organizationId}, optionally together with global rows. */
        ORGANIZATION
    }

    public OrgFilter {
        Objects.requireNonNull(mode, "mode");
        if (mode == Mode.ORGANIZATION && organizationId == null) {
            throw new IllegalArgumentException("organizationId is required for ORGANIZATION mode");
        }
        if (mode != Mode.ORGANIZATION) {
            organizationId = null;
            includeGlobal = false;
        }
    }

    public static OrgFilter unrestricted() {
        return new OrgFilter(Mode.UNRESTRICTED, null, false);
    }

    public static OrgFilter globalOnly() {
        return new OrgFilter(Mode.GLOBAL_ONLY, null, false);
    }

    public static OrgFilter organization(String organizationId, boolean includeGlobal) {
        return new OrgFilter(Mode.ORGANIZATION, organizationId, includeGlobal);
    }

    /** Whether a row with the given organization id passes this filter. */
    public boolean matches(String rowOrganizationId) {
        return switch (mode) {
            case UNRESTRICTED -> true;
            case GLOBAL_ONLY -> rowOrganizationId == null;
            case ORGANIZATION -> organizationId.equals(rowOrganizationId)
                    || (includeGlobal && rowOrganizationId == null);
        };
    }
}

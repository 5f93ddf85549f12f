package com.keystone.security;

/** Why an access decision was negative. Used as a metric tag, so values are stable. */
public enum DenialReason {
    MISSING_PERMISSIONS("missing_permissions"),
    MISSING_ROLES("missing_roles"),
    POLICY_DENIED("policy_denied"),
    CROSS_ORGANIZATION("cross_organization");

    private final String tag;

    DenialReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

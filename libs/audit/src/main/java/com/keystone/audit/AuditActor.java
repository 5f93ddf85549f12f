package com.keystone.audit;

import com.keystone.security.Principal;

/**
 * Who performed an audited action. Every field is optional; system events have no actor id.
 */
public record AuditActor(String id, String type, String email, String ip, String userAgent) {

    public static final AuditActor NONE = new AuditActor(null, null, null, null, null);

    public static AuditActor system() {
        return new AuditActor(null, "system", null, null, null);
    }

    public static AuditActor of(Principal principal) {
        return of(principal, null, null);
    }

    public static AuditActor of(Principal principal, String ip, String userAgent) {
        return new AuditActor(principal.subjectId(), "user", principal.email(), ip, userAgent);
    }
}

package com.keystone.compliance;

import com.keystone.audit.AuditEventType;
import java.util.Set;

/**
 * A single control of a framework.
 *
 * @param evidence audit event types whose records count as evidence; empty when the control is not
 *                 instrumented
 */
public record ControlDefinition(String id, String name, String description, Set<AuditEventType> evidence) {

    public ControlDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        evidence = evidence == null ? Set.of() : Set.copyOf(evidence);
    }

    public boolean instrumented() {
        return !evidence.isEmpty();
    }
}

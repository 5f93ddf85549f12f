package com.keystone.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.security.OrganizationScoped;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One immutable, hash-chained entry of the audit trail.
 *
 * <p>{@code currentHash} covers the record's own content (see {@link AuditHasher});
 * {@code previousHash} is the {@code currentHash} of the record written before it in the same chain
 * scope, or null for the first record of a scope. Corrections are new records, never updates.
 */
public record AuditRecord(
        String id,
        Instant timestamp,
        AuditEventType eventType,
        AuditSeverity severity,
        AuditOutcome outcome,
        AuditActor actor,
        AuditTarget target,
        String organizationId,
        String description,
        Map<String, Object> changes,
        Map<String, Object> metadata,
        String requestId,
        String sessionId,
        String geoCountry,
        String geoCity,
        String previousHash,
        String currentHash) implements OrganizationScoped {

    public AuditRecord {
        if (id == null || timestamp == null || eventType == null) {
            throw new IllegalArgumentException("id, timestamp and eventType are required");
        }
        severity = severity == null ? AuditSeverity.INFO : severity;
        outcome = outcome == null ? AuditOutcome.SUCCESS : outcome;
        actor = actor == null ? AuditActor.NONE : actor;
        target = target == null ? AuditTarget.NONE : target;
        changes = unmodifiable(changes);
        metadata = unmodifiable(metadata);
    }

    /** Builds an unhashed record from an event; the ledger completes it with {@link #withCurrentHash}. */
    static AuditRecord draft(
            String id, Instant timestamp, AuditEvent event, Map<String, Object> changes,
            Map<String, Object> metadata, String requestId, String previousHash) {
        return new AuditRecord(id, timestamp, event.eventType(), event.severity(), event.outcome(),
                event.actor(), event.target(), event.organizationId(), event.description(), changes, metadata,
                requestId, event.sessionId(), event.geoCountry(), event.geoCity(), previousHash, null);
    }

    AuditRecord withCurrentHash(String hash) {
        return new AuditRecord(id, timestamp, eventType, severity, outcome, actor, target, organizationId,
                description, changes, metadata, requestId, sessionId, geoCountry, geoCity, previousHash, hash);
    }

    @JsonProperty("eventCategory")
    public String eventCategory() {
        return eventType.category();
    }

    @Override
    @JsonIgnore
    public Optional<String> organization() {
        return Optional.ofNullable(organizationId);
    }

    public boolean isSecurityEvent() {
        return AuditEventType.SECURITY_CATEGORIES.contains(eventCategory());
    }

    public boolean isFailure() {
        return outcome == AuditOutcome.FAILURE;
    }

    public boolean isHighSeverity() {
        return severity.isHigh();
    }

    public ChainScope chainScope() {
        return ChainScope.of(organizationId);
    }

    private static Map<String, Object> unmodifiable(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

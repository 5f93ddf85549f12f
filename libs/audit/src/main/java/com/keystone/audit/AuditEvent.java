package com.keystone.audit;

import com.keystone.security.Principal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input to {@link AuditLedger#append(AuditEvent)}: everything about an event except the identity,
 * timestamp and hash chain fields the ledger assigns.
 *
 * <p>Severity defaults to {@link AuditSeverity#INFO}, outcome to {@link AuditOutcome#SUCCESS}.
 * A null organization makes the event global.
 */
public record AuditEvent(
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
        String geoCity) {

    public AuditEvent {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType must not be null");
        }
        severity = severity == null ? AuditSeverity.INFO : severity;
        outcome = outcome == null ? AuditOutcome.SUCCESS : outcome;
        actor = actor == null ? AuditActor.NONE : actor;
        target = target == null ? AuditTarget.NONE : target;
        changes = changes == null ? Map.of() : changes;
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static AuditEvent of(AuditEventType type, AuditActor actor, String organizationId, String description) {
        return new AuditEvent(type, null, null, actor, null, organizationId, description,
                null, null, null, null, null, null);
    }

    /** Login, logout, MFA and password events. Failures are recorded as warnings. */
    public static AuditEvent authentication(
            AuditEventType type, Principal principal, boolean success, String ip, String userAgent) {
        return new AuditEvent(
                type,
                success ? AuditSeverity.INFO : AuditSeverity.WARNING,
                success ? AuditOutcome.SUCCESS : AuditOutcome.FAILURE,
                AuditActor.of(principal, ip, userAgent),
                AuditTarget.user(principal.subjectId(), principal.email()),
                principal.organizationId(),
                null, null, null, null, null, null, null);
    }

    public static AuditEvent userAction(
            AuditEventType type, Principal actor, String organizationId, String targetUserId,
            String targetEmail, Map<String, Object> changes, String description) {
        return new AuditEvent(type, null, null, AuditActor.of(actor),
                AuditTarget.user(targetUserId, targetEmail), organizationId, description,
                changes, null, null, null, null, null);
    }

    public static AuditEvent teamAction(
            AuditEventType type, Principal actor, String organizationId, String teamId,
            String teamName, Map<String, Object> changes, String description) {
        return new AuditEvent(type, null, null, AuditActor.of(actor),
                AuditTarget.team(teamId, teamName), organizationId, description,
                changes, null, null, null, null, null);
    }

    public static AuditEvent accessDenied(
            Principal actor, String organizationId, String resourceType, String resourceId, String reason) {
        return new AuditEvent(AuditEventType.ACCESS_DENIED, AuditSeverity.WARNING, AuditOutcome.FAILURE,
                AuditActor.of(actor), new AuditTarget(resourceType, resourceId, null), organizationId,
                reason == null ? "Permission denied" : reason, null, null, null, null, null, null);
    }

    /**
     * A system administrator acting on another organization. Recorded in the target organization's
     * chain with the administrator's own organization in metadata.
     */
    public static AuditEvent adminOverride(
            Principal admin, String originalOrgId, String targetOrgId, String method, String path) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("original_organization_id", originalOrgId);
        metadata.put("method", method);
        metadata.put("path", path);
        return new AuditEvent(AuditEventType.ADMIN_OVERRIDE, AuditSeverity.NOTICE, AuditOutcome.SUCCESS,
                AuditActor.of(admin), new AuditTarget("organization", targetOrgId, null), targetOrgId,
                "Organization override to " + targetOrgId, null, metadata, null, null, null, null);
    }

    /** Returns a copy carrying request correlation fields. */
    public AuditEvent withRequest(String newRequestId, String newSessionId) {
        return new AuditEvent(eventType, severity, outcome, actor, target, organizationId, description,
                changes, metadata, newRequestId, newSessionId, geoCountry, geoCity);
    }

    public AuditEvent withActorNetwork(String ip, String userAgent) {
        return new AuditEvent(eventType, severity, outcome,
                new AuditActor(actor.id(), actor.type(), actor.email(), ip, userAgent),
                target, organizationId, description, changes, metadata, requestId, sessionId, geoCountry, geoCity);
    }
}

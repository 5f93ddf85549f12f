package com.keystone.audit;

import com.keystone.security.OrgFilter;
import java.time.Instant;
import java.util.Set;

/**
 * Filter over audit records. Null fields and empty sets do not restrict.
 *
 * @param scope            tenant filter (required)
 * @param eventTypes       record's type must be one of these
 * @param actorId          exact actor id
 * @param targetType       exact target type
 * @param targetId         exact target id
 * @param severity         exact severity
 * @param outcome          exact outcome
 * @param from             inclusive lower bound on timestamp
 * @param to               inclusive upper bound on timestamp
 * @param securityRelevant only auth/access/admin events or high-severity events
 * @param involvedUserId   records where the user is the actor or the targeted user
 */
public record AuditQuery(
        OrgFilter scope,
        Set<AuditEventType> eventTypes,
        String actorId,
        String targetType,
        String targetId,
        AuditSeverity severity,
        AuditOutcome outcome,
        Instant from,
        Instant to,
        boolean securityRelevant,
        String involvedUserId) {

    public AuditQuery {
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    public static AuditQuery scoped(OrgFilter scope) {
        return new AuditQuery(scope, Set.of(), null, null, null, null, null, null, null, false, null);
    }

    public AuditQuery withEventTypes(Set<AuditEventType> types) {
        return new AuditQuery(scope, types, actorId, targetType, targetId, severity, outcome, from, to,
                securityRelevant, involvedUserId);
    }

    public AuditQuery withActor(String actor) {
        return new AuditQuery(scope, eventTypes, actor, targetType, targetId, severity, outcome, from, to,
                securityRelevant, involvedUserId);
    }

    public AuditQuery withTarget(String type, String id) {
        return new AuditQuery(scope, eventTypes, actorId, type, id, severity, outcome, from, to,
                securityRelevant, involvedUserId);
    }

    public AuditQuery withSeverity(AuditSeverity value) {
        return new AuditQuery(scope, eventTypes, actorId, targetType, targetId, value, outcome, from, to,
                securityRelevant, involvedUserId);
    }

    public AuditQuery withOutcome(AuditOutcome value) {
        return new AuditQuery(scope, eventTypes, actorId, targetType, targetId, severity, value, from, to,
                securityRelevant, involvedUserId);
    }

    public AuditQuery between(Instant start, Instant end) {
        return new AuditQuery(scope, eventTypes, actorId, targetType, targetId, severity, outcome, start, end,
                securityRelevant, involvedUserId);
    }

    public AuditQuery securityRelevantOnly() {
        return new AuditQuery(scope, eventTypes, actorId, targetType, targetId, severity, outcome, from, to,
                true, involvedUserId);
    }

    public AuditQuery involving(String userId) {
        return new AuditQuery(scope, eventTypes, actorId, targetType, targetId, severity, outcome, from, to,
                securityRelevant, userId);
    }

    /** In-memory evaluation; stores translating to SQL must agree with this. */
    public boolean matches(AuditRecord record) {
        if (!scope.matches(record.organizationId())) {
            return false;
        }
        if (!eventTypes.isEmpty() && !eventTypes.contains(record.eventType())) {
            return false;
        }
        if (actorId != null && !actorId.equals(record.actor().id())) {
            return false;
        }
        if (targetType != null && !targetType.equals(record.target().type())) {
            return false;
        }
        if (targetId != null && !targetId.equals(record.target().id())) {
            return false;
        }
        if (severity != null && severity != record.severity()) {
            return false;
        }
        if (outcome != null && outcome != record.outcome()) {
            return false;
        }
        if (from != null && record.timestamp().isBefore(from)) {
            return false;
        }
        if (to != null && record.timestamp().isAfter(to)) {
            return false;
        }
        if (securityRelevant && !(record.isSecurityEvent() || record.isHighSeverity())) {
            return false;
        }
        if (involvedUserId != null) {
            boolean actor = involvedUserId.equals(record.actor().id());
            boolean target = "user".equals(record.target().type()) && involvedUserId.equals(record.target().id());
            return actor || target;
        }
        return true;
    }
}

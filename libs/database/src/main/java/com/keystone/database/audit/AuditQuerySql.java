package com.keystone.database.audit;

import com.keystone.audit.AuditEventType;
import com.keystone.audit.AuditQuery;
import com.keystone.audit.AuditSeverity;
import com.keystone.database.OrgFilterSql;
import com.keystone.security.OrgFilter;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * WHERE clause and bind arguments for an {@link AuditQuery}. Must select exactly the records
 * {@link AuditQuery#matches} accepts.
 */
final class AuditQuerySql {

    private final List<String> conditions = new ArrayList<>();
    private final List<Object> args = new ArrayList<>();

    private AuditQuerySql() {}

    static AuditQuerySql of(AuditQuery query) {
        AuditQuerySql sql = new AuditQuerySql();
        sql.scope(query.scope());
        if (!query.eventTypes().isEmpty()) {
            sql.in("event_type", query.eventTypes().stream()
                    .map(AuditStorageCodes.EVENT_TYPES::encode)
                    .sorted()
                    .collect(Collectors.toList()));
        }
        sql.equal("actor_id", query.actorId());
        sql.equal("target_type", query.targetType());
        sql.equal("target_id", query.targetId());
        sql.equal("severity", AuditStorageCodes.SEVERITIES.encode(query.severity()));
        sql.equal("outcome", AuditStorageCodes.OUTCOMES.encode(query.outcome()));
        if (query.from() != null) {
            sql.add("occurred_at >= ?", utc(query.from()));
        }
        if (query.to() != null) {
            sql.add("occurred_at <= ?", utc(query.to()));
        }
        if (query.securityRelevant()) {
            List<Object> securityArgs = new ArrayList<>(AuditEventType.SECURITY_CATEGORIES.stream().sorted().toList());
            AuditSeverity.HIGH.stream().map(AuditStorageCodes.SEVERITIES::encode).sorted().forEach(securityArgs::add);
            sql.conditions.add("(event_category IN (" + placeholders(AuditEventType.SECURITY_CATEGORIES.size())
                    + ") OR severity IN (" + placeholders(AuditSeverity.HIGH.size()) + "))");
            sql.args.addAll(securityArgs);
        }
        if (query.involvedUserId() != null) {
            sql.conditions.add("(actor_id = ? OR (target_type = 'user' AND target_id = ?))");
            sql.args.add(query.involvedUserId());
            sql.args.add(query.involvedUserId());
        }
        return sql;
    }

    static AuditQuerySql forScope(OrgFilter scope) {
        AuditQuerySql sql = new AuditQuerySql();
        sql.scope(scope);
        return sql;
    }

    AuditQuerySql and(String condition, Object arg) {
        add(condition, arg);
        return this;
    }

    /** {@code " WHERE ..."}, or an empty string when nothing restricts. */
    String where() {
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    Object[] args(Object... trailing) {
        List<Object> all = new ArrayList<>(args);
        all.addAll(List.of(trailing));
        return all.toArray();
    }

    static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private void scope(OrgFilter scope) {
        OrgFilterSql.condition(scope, "organization_id", args).ifPresent(conditions::add);
    }

    private void equal(String column, Object value) {
        if (value != null) {
            add(column + " = ?", value);
        }
    }

    private void in(String column, Collection<?> values) {
        conditions.add(column + " IN (" + placeholders(values.size()) + ")");
        args.addAll(values);
    }

    private void add(String condition, Object arg) {
        conditions.add(condition);
        args.add(arg);
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}

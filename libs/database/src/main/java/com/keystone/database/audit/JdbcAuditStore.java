package com.keystone.database.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.audit.AuditActor;
import com.keystone.audit.AuditEventType;
import com.keystone.audit.AuditQuery;
import com.keystone.audit.AuditRecord;
import com.keystone.audit.AuditStore;
import com.keystone.audit.AuditTarget;
import com.keystone.audit.ChainHead;
import com.keystone.audit.ChainScope;
import com.keystone.security.OrgFilter;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link AuditStore} on the {@code audit_logs} table.
 *
 * <p>Each chain scope owns a row in {@code audit_chain_heads}. An append locks that row with
 * {@code SELECT ... FOR UPDATE}, inserts the record and moves the head in one transaction, so
 * concurrent appends to a scope are serialized by the database while other scopes proceed.
 */
public class JdbcAuditStore implements AuditStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditStore.class);

    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {};

    private static final String COLUMNS = "id, occurred_at, event_type, event_category, severity, outcome, "
            + "actor_id, actor_type, actor_email, actor_ip, actor_user_agent, target_type, target_id, target_name, "
            + "organization_id, description, changes, metadata, request_id, session_id, geo_country, geo_city, "
            + "previous_hash, current_hash";

    private static final String INSERT = "INSERT INTO audit_logs (" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate appendTransaction;
    private final TransactionTemplate headTransaction;
    private final ObjectMapper objectMapper;
    private final RowMapper<AuditRecord> rowMapper = this::mapRecord;

    public JdbcAuditStore(DataSource dataSource, ObjectMapper objectMapper) {
        this(new JdbcTemplate(dataSource), new DataSourceTransactionManager(dataSource), objectMapper);
    }

    public JdbcAuditStore(JdbcTemplate jdbc, PlatformTransactionManager transactionManager, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.appendTransaction = new TransactionTemplate(transactionManager);
        this.headTransaction = new TransactionTemplate(transactionManager);
        this.headTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public AuditRecord appendToChain(ChainScope scope, Function<Optional<ChainHead>, AuditRecord> nextRecord) {
        ensureHeadRow(scope);
        return appendTransaction.execute(status -> {
            Optional<ChainHead> head = jdbc.queryForObject(
                    "SELECT record_id, record_hash, recorded_at FROM audit_chain_heads WHERE scope_key = ? FOR UPDATE",
                    (rs, rowNum) -> mapHead(rs),
                    scope.key());
            AuditRecord record = nextRecord.apply(head);
            insert(record);
            jdbc.update("UPDATE audit_chain_heads SET record_id = ?, record_hash = ?, recorded_at = ? WHERE scope_key = ?",
                    record.id(), record.currentHash(), AuditQuerySql.utc(record.timestamp()), scope.key());
            return record;
        });
    }

    @Override
    public Optional<AuditRecord> findById(String id, OrgFilter scope) {
        AuditQuerySql sql = AuditQuerySql.forScope(scope).and("id = ?", id);
        List<AuditRecord> found = jdbc.query("SELECT " + COLUMNS + " FROM audit_logs" + sql.where(), rowMapper, sql.args());
        return found.stream().findFirst();
    }

    @Override
    public List<AuditRecord> find(AuditQuery query, int offset, int limit) {
        AuditQuerySql sql = AuditQuerySql.of(query);
        return jdbc.query("SELECT " + COLUMNS + " FROM audit_logs" + sql.where()
                        + " ORDER BY occurred_at DESC, id DESC LIMIT ? OFFSET ?",
                rowMapper, sql.args(limit, offset));
    }

    @Override
    public long count(AuditQuery query) {
        AuditQuerySql sql = AuditQuerySql.of(query);
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM audit_logs" + sql.where(), Long.class, sql.args());
        return count == null ? 0 : count;
    }

    @Override
    public Map<String, Long> countByCategory(AuditQuery query) {
        AuditQuerySql sql = AuditQuerySql.of(query);
        Map<String, Long> result = new LinkedHashMap<>();
        jdbc.query("SELECT event_category, COUNT(*) AS total FROM audit_logs" + sql.where()
                        + " GROUP BY event_category ORDER BY event_category",
                rs -> {
                    result.put(rs.getString("event_category"), rs.getLong("total"));
                },
                sql.args());
        return result;
    }

    @Override
    public List<AuditRecord> chain(ChainScope scope, int limit) {
        OrgFilter filter = scope.isGlobal()
                ? OrgFilter.globalOnly()
                : OrgFilter.organization(scope.organizationId(), false);
        AuditQuerySql sql = AuditQuerySql.forScope(filter);
        return jdbc.query("SELECT " + COLUMNS + " FROM audit_logs" + sql.where()
                        + " ORDER BY occurred_at ASC, id ASC LIMIT ?",
                rowMapper, sql.args(limit));
    }

    private void ensureHeadRow(ChainScope scope) {
        Long existing = jdbc.queryForObject(
                "SELECT COUNT(*) FROM audit_chain_heads WHERE scope_key = ?", Long.class, scope.key());
        if (existing != null && existing > 0) {
            return;
        }
        try {
            headTransaction.executeWithoutResult(status ->
                    jdbc.update("INSERT INTO audit_chain_heads (scope_key) VALUES (?)", scope.key()));
            log.debug("Created audit chain head for scope {}", scope.key());
        } catch (DuplicateKeyException e) {
            log.debug("Audit chain head for scope {} was created concurrently", scope.key());
        }
    }

    private void insert(AuditRecord record) {
        jdbc.update(INSERT,
                record.id(),
                AuditQuerySql.utc(record.timestamp()),
                AuditStorageCodes.EVENT_TYPES.encode(record.eventType()),
                record.eventCategory(),
                AuditStorageCodes.SEVERITIES.encode(record.severity()),
                AuditStorageCodes.OUTCOMES.encode(record.outcome()),
                record.actor().id(),
                record.actor().type(),
                record.actor().email(),
                record.actor().ip(),
                record.actor().userAgent(),
                record.target().type(),
                record.target().id(),
                record.target().name(),
                record.organizationId(),
                record.description(),
                toJson(record.changes()),
                toJson(record.metadata()),
                record.requestId(),
                record.sessionId(),
                record.geoCountry(),
                record.geoCity(),
                record.previousHash(),
                record.currentHash());
    }

    private AuditRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        AuditEventType eventType = AuditStorageCodes.EVENT_TYPES.decode(rs.getString("event_type"));
        return new AuditRecord(
                rs.getString("id"),
                instant(rs, "occurred_at"),
                eventType,
                AuditStorageCodes.SEVERITIES.decode(rs.getString("severity")),
                AuditStorageCodes.OUTCOMES.decode(rs.getString("outcome")),
                new AuditActor(
                        rs.getString("actor_id"),
                        rs.getString("actor_type"),
                        rs.getString("actor_email"),
                        rs.getString("actor_ip"),
                        rs.getString("actor_user_agent")),
                new AuditTarget(rs.getString("target_type"), rs.getString("target_id"), rs.getString("target_name")),
                rs.getString("organization_id"),
                rs.getString("description"),
                fromJson(rs.getString("changes")),
                fromJson(rs.getString("metadata")),
                rs.getString("request_id"),
                rs.getString("session_id"),
                rs.getString("geo_country"),
                rs.getString("geo_city"),
                rs.getString("previous_hash"),
                rs.getString("current_hash"));
    }

    private static Optional<ChainHead> mapHead(ResultSet rs) throws SQLException {
        String recordId = rs.getString("record_id");
        if (recordId == null) {
            return Optional.empty();
        }
        return Optional.of(new ChainHead(recordId, rs.getString("record_hash"), instant(rs, "recorded_at")));
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private String toJson(Map<String, Object> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit payload is not serializable as JSON", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, JSON_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored audit payload is not valid JSON", e);
        }
    }
}

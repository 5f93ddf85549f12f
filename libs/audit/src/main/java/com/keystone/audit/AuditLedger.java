package com.keystone.audit;

import com.keystone.observability.RequestContext;
import com.keystone.observability.RequestContextHolder;
import com.keystone.observability.SecurityMetrics;
import com.keystone.observability.SensitiveDataRedactor;
import com.keystone.security.OrgFilter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, hash-chained audit trail.
 *
 * <p>Each organization has its own chain; records without an organization form the global chain.
 * Serialization of appends within a chain is delegated to {@link AuditStore#appendToChain}.
 *
 * <p>Timestamps are truncated to microseconds and kept strictly increasing within a chain, so a
 * record's position is unambiguous and its stored timestamp re-hashes identically after a round
 * trip through the database.
 */
public final class AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    public static final int DEFAULT_VERIFY_LIMIT = 1000;
    public static final int MAX_PAGE_SIZE = 500;

    private final AuditStore store;
    private final SensitiveDataRedactor redactor;
    private final SecurityMetrics metrics;
    private final Clock clock;

    public AuditLedger(AuditStore store, SensitiveDataRedactor redactor, SecurityMetrics metrics, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
        this.redactor = redactor == null ? new SensitiveDataRedactor() : redactor;
        this.metrics = metrics == null ? SecurityMetrics.noop() : metrics;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public AuditLedger(AuditStore store) {
        this(store, new SensitiveDataRedactor(), SecurityMetrics.noop(), Clock.systemUTC());
    }

    /**
     * Appends an event to its organization's chain (or the global chain).
     *
     * <p>Secret-looking keys in {@code changes} and {@code metadata} are redacted first. A missing
     * request id is taken from the current {@link RequestContext}.
     */
    public AuditRecord append(AuditEvent event) {
        ChainScope scope = ChainScope.of(event.organizationId());
        Map<String, Object> changes = redactor.redact(event.changes());
        Map<String, Object> metadata = redactor.redact(event.metadata());
        String requestId = event.requestId() != null
                ? event.requestId()
                : RequestContextHolder.get().map(RequestContext::requestId).orElse(null);

        AuditRecord record = store.appendToChain(scope, head -> {
            AuditRecord draft = AuditRecord.draft(
                    UUID.randomUUID().toString(),
                    nextTimestamp(head),
                    event,
                    changes,
                    metadata,
                    requestId,
                    head.map(ChainHead::hash).orElse(null));
            return draft.withCurrentHash(AuditHasher.hash(draft));
        });

        metrics.auditAppended(record.eventCategory());
        log.debug("Audit record appended: id={}, type={}, scope={}",
                record.id(), record.eventType().value(), scope.key());
        return record;
    }

    /**
     * @param page     1-based page number
     * @param pageSize records per page, capped at {@value #MAX_PAGE_SIZE}
     */
    public AuditPage query(AuditQuery query, int page, int pageSize) {
        int safePage = Math.max(page, 1);
        int safeSize = Math.min(Math.max(pageSize, 1), MAX_PAGE_SIZE);
        long total = store.count(query);
        List<AuditRecord> records = store.find(query, (safePage - 1) * safeSize, safeSize);
        return new AuditPage(records, total, safePage, safeSize);
    }

    public Optional<AuditRecord> findById(String id, OrgFilter scope) {
        return store.findById(id, scope);
    }

    /** Records where the user acted or was the targeted user, newest first. */
    public List<AuditRecord> userActivity(String userId, OrgFilter scope, int limit) {
        return store.find(AuditQuery.scoped(scope).involving(userId), 0, limit);
    }

    /** Auth, access and admin events plus high-severity events within the trailing window. */
    public List<AuditRecord> securityEvents(OrgFilter scope, Duration window, int limit) {
        AuditQuery query = AuditQuery.scoped(scope)
                .securityRelevantOnly()
                .between(clock.instant().minus(window), null);
        return store.find(query, 0, limit);
    }

    public AuditSummary summary(OrgFilter scope, Duration window) {
        AuditQuery base = AuditQuery.scoped(scope).between(clock.instant().minus(window), null);
        return new AuditSummary(
                window.toDays(),
                store.count(base),
                store.countByCategory(base),
                store.count(base.withOutcome(AuditOutcome.FAILURE)),
                countHighSeverity(base));
    }

    /** Number of records of the given types in {@code [from, to]}; used as compliance evidence. */
    public long countEvidence(OrgFilter scope, Set<AuditEventType> types, Instant from, Instant to) {
        if (types.isEmpty()) {
            return 0;
        }
        return store.count(AuditQuery.scoped(scope).withEventTypes(types).between(from, to));
    }

    public long count(AuditQuery query) {
        return store.count(query);
    }

    public ChainIntegrityReport verifyChain(ChainScope scope) {
        return verifyChain(scope, DEFAULT_VERIFY_LIMIT);
    }

    /**
     * Re-hashes the first {@code limit} records of a chain and checks every link.
     *
     * <p>Reports a {@link ChainIntegrityReport.Issue#HASH_MISMATCH} for a record whose content no
     * longer matches its stored hash, and a {@link ChainIntegrityReport.Issue#CHAIN_BROKEN} for a
     * record whose previous hash is not its predecessor's hash. The first record must have no
     * predecessor.
     */
    public ChainIntegrityReport verifyChain(ChainScope scope, int limit) {
        List<AuditRecord> chain = store.chain(scope, limit);
        List<ChainIntegrityReport.BrokenLink> broken = new ArrayList<>();

        String predecessorHash = null;
        for (AuditRecord record : chain) {
            String expected = AuditHasher.hash(record);
            if (!expected.equals(record.currentHash())) {
                broken.add(new ChainIntegrityReport.BrokenLink(
                        record.id(), ChainIntegrityReport.Issue.HASH_MISMATCH, expected, record.currentHash()));
            }
            if (!Objects.equals(predecessorHash, record.previousHash())) {
                broken.add(new ChainIntegrityReport.BrokenLink(
                        record.id(), ChainIntegrityReport.Issue.CHAIN_BROKEN, predecessorHash, record.previousHash()));
            }
            predecessorHash = record.currentHash();
        }

        ChainIntegrityReport report = ChainIntegrityReport.of(scope, chain.size(), broken);
        if (!report.valid()) {
            metrics.brokenChainLinks(broken.size());
            log.error("Audit chain integrity violation: scope={}, brokenLinks={}", scope.key(), broken.size());
        } else {
            log.info("Audit chain verified: scope={}, records={}", scope.key(), chain.size());
        }
        return report;
    }

    private long countHighSeverity(AuditQuery base) {
        long total = 0;
        for (AuditSeverity severity : AuditSeverity.HIGH) {
            total += store.count(base.withSeverity(severity));
        }
        return total;
    }

    private Instant nextTimestamp(Optional<ChainHead> head) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        if (head.isPresent() && !now.isAfter(head.get().timestamp())) {
            return head.get().timestamp().plus(1, ChronoUnit.MICROS);
        }
        return now;
    }
}

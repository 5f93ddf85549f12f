package com.keystone.audit;

import com.keystone.security.OrgFilter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Persistence of audit records.
 *
 * <p>Implementations never update or delete records through this interface.
 */
public interface AuditStore {

    /**
     * Appends the next record of a chain.
     *
     * <p>Reads the scope's current head, passes it to {@code nextRecord} and persists the result as
     * one atomic step. At most one append per scope may be in flight; appends to different scopes
     * must not block each other. If persisting fails nothing is written and the head is unchanged.
     *
     * @param nextRecord builds the record from the current head (empty for a new chain)
     * @return the persisted record
     */
    AuditRecord appendToChain(ChainScope scope, Function<Optional<ChainHead>, AuditRecord> nextRecord);

    Optional<AuditRecord> findById(String id, OrgFilter scope);

    /** Matching records, newest first. */
    List<AuditRecord> find(AuditQuery query, int offset, int limit);

    long count(AuditQuery query);

    /** Matching record counts keyed by event category. */
    Map<String, Long> countByCategory(AuditQuery query);

    /** The first {@code limit} records of a chain, oldest first. */
    List<AuditRecord> chain(ChainScope scope, int limit);
}

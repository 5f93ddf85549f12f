package com.keystone.audit;

import java.time.Instant;

/**
 * The most recently written record of a chain scope, as seen inside an append.
 *
 * @param recordId  id of that record
 * @param hash      its {@code currentHash}
 * @param timestamp its timestamp
 */
public record ChainHead(String recordId, String hash, Instant timestamp) {

    public static ChainHead of(AuditRecord record) {
        return new ChainHead(record.id(), record.currentHash(), record.timestamp());
    }
}

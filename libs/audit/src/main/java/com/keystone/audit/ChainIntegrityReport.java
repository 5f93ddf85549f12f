package com.keystone.audit;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Result of verifying one chain scope. Integrity problems are reported here as data; verification
 * itself does not fail.
 *
 * @param scope         the verified chain
 * @param verifiedCount number of records inspected
 * @param valid         true iff no broken links were found
 * @param brokenLinks   every problem found, in chain order
 */
public record ChainIntegrityReport(ChainScope scope, int verifiedCount, boolean valid, List<BrokenLink> brokenLinks) {

    public ChainIntegrityReport {
        brokenLinks = List.copyOf(brokenLinks);
    }

    public static ChainIntegrityReport of(ChainScope scope, int verifiedCount, List<BrokenLink> brokenLinks) {
        return new ChainIntegrityReport(scope, verifiedCount, brokenLinks.isEmpty(), brokenLinks);
    }

    public enum Issue {
        /** Stored hash differs from the hash recomputed from the record's content. */
        HASH_MISMATCH("hash_mismatch"),
        /** previousHash does not match the preceding record's hash. */
        CHAIN_BROKEN("chain_broken");

        private final String value;

        Issue(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    /**
     * @param recordId offending record
     * @param issue    kind of problem
     * @param expected hash that should have been stored
     * @param actual   hash actually stored
     */
    public record BrokenLink(String recordId, Issue issue, String expected, String actual) {
    }
}

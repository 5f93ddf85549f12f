package com.keystone.audit;

import java.util.Map;

/**
 * Aggregate counts over a trailing window.
 *
 * @param periodDays         length of the window in days
 * @param totalEvents        all records in the window
 * @param byCategory         record count per event category
 * @param failedEvents       records with outcome failure
 * @param highSeverityEvents records with severity error, critical or alert
 */
public record AuditSummary(
        long periodDays, long totalEvents, Map<String, Long> byCategory, long failedEvents, long highSeverityEvents) {

    public AuditSummary {
        byCategory = Map.copyOf(byCategory);
    }
}

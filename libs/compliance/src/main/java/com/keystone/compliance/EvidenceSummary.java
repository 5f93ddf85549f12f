package com.keystone.compliance;

/** Audit activity within a report period. */
public record EvidenceSummary(
        long totalEvents, long securityEvents, long failedAuthentications, long accessDeniedEvents) {}

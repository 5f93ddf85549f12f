package com.keystone.audit;

import java.util.List;

/**
 * One page of query results, newest first.
 *
 * @param records  the page content
 * @param total    number of matching records across all pages
 * @param page     1-based page number
 * @param pageSize requested page size
 */
public record AuditPage(List<AuditRecord> records, long total, int page, int pageSize) {

    public AuditPage {
        records = List.copyOf(records);
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) ((total + pageSize - 1) / pageSize);
    }
}

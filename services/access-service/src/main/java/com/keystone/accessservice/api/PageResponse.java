package com.keystone.accessservice.api;

import java.util.List;

/**
 * Envelope of paginated list endpoints.
 *
 * @param data the page content
 * @param meta position of the page in the full result
 */
public record PageResponse<T>(List<T> data, Meta meta) {

    public static <T> PageResponse<T> of(List<T> data, int page, int pageSize, long total) {
        int totalPages = (int) ((total + pageSize - 1) / pageSize);
        return new PageResponse<>(data, new Meta(page, pageSize, total, totalPages, page < totalPages, page > 1));
    }

    public record Meta(int page, int pageSize, long total, int totalPages, boolean hasNext, boolean hasPrevious) {
    }
}

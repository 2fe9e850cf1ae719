package com.nosota.unipay.api.dto;

import java.util.List;

/**
 * Page of results returned by list endpoints.
 *
 * @param content       Items of the current page
 * @param pageNumber    Zero-based page index
 * @param pageSize      Requested page size
 * @param totalElements Total number of items across all pages
 * @param totalPages    Total number of pages
 * @param last          Whether this is the last page
 * @param <T>           Item type
 */
public record PagedResponse<T>(
        List<T> content,
        int pageNumber,
        int pageSize,
        long totalElements,
        int totalPages,
        boolean last
) {
}

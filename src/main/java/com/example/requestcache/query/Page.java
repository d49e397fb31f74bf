package com.example.requestcache.query;

import java.util.List;

/**
 * Paginated response body: the rows plus navigation metadata.
 */
public record Page<T>(List<T> data, Pagination pagination) {

    public record Pagination(
        int currentPage,
        long totalPages,
        long totalItems,
        int itemsPerPage,
        boolean hasNextPage,
        boolean hasPrevPage,
        Integer nextPage,
        Integer prevPage
    ) {
    }

    public static <T> Page<T> of(PageSlice<T> slice, PageQuery query) {
        int page = query.page();
        int pageSize = query.pageSize();
        long totalPages = (slice.totalCount() + pageSize - 1) / pageSize;
        boolean hasNext = page < totalPages;
        boolean hasPrev = page > 1;
        Pagination pagination = new Pagination(
            page,
            totalPages,
            slice.totalCount(),
            pageSize,
            hasNext,
            hasPrev,
            hasNext ? page + 1 : null,
            hasPrev ? page - 1 : null);
        return new Page<>(slice.rows(), pagination);
    }
}

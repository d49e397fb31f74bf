package com.example.requestcache.query;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One page of a filtered, sorted listing of {@code entityType}. Pages are 1-based.
 * The filter is copied into key order so equal filters build equal cache keys.
 */
public record PageQuery(String entityType, Map<String, Object> filter, SortSpec sort, int page, int pageSize) {

    public PageQuery {
        Objects.requireNonNull(entityType, "entityType");
        if (entityType.isBlank()) {
            throw new IllegalArgumentException("entityType must not be blank");
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1, got " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1, got " + pageSize);
        }
        filter = filter == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(new TreeMap<>(filter));
    }

    public int offset() {
        return (page - 1) * pageSize;
    }
}

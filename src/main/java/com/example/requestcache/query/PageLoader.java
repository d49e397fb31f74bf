package com.example.requestcache.query;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Data store call behind a paginated listing (count + fetch). Only invoked on a cache miss.
 */
@FunctionalInterface
public interface PageLoader<T> {

    CompletableFuture<PageSlice<T>> load(Map<String, Object> filter, SortSpec sort, int page, int pageSize);
}

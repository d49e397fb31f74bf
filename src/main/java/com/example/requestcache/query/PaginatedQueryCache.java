package com.example.requestcache.query;

import com.example.requestcache.key.CacheKeyParts;
import com.example.requestcache.key.CacheKeys;
import com.example.requestcache.refresh.ReadThroughCache;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-through cache for paginated listings.
 *
 * <p>The key is {@code entityType:[filter,sort,page,pageSize]}, so every cached page of an entity
 * shares the entity type as a token. Write paths flush them with
 * {@code CacheStore#invalidatePattern(entityType)}; this class never invalidates on its own.
 */
@Slf4j
public class PaginatedQueryCache {

    private final ReadThroughCache readThrough;
    private final CacheKeys cacheKeys;
    private final Map<String, Duration> entityTtl;
    private final long defaultTtlMillis;

    public PaginatedQueryCache(
        ReadThroughCache readThrough, CacheKeys cacheKeys, Map<String, Duration> entityTtl, long defaultTtlMillis) {
        this.readThrough = readThrough;
        this.cacheKeys = cacheKeys;
        this.entityTtl = new HashMap<>(entityTtl);
        this.defaultTtlMillis = defaultTtlMillis;
    }

    public <T> CompletableFuture<Page<T>> find(PageQuery query, PageLoader<T> loader) {
        String key;
        try {
            key = keyFor(query);
        } catch (RuntimeException e) {
            log.warn("Page cache key derivation failed, loading uncached: entityType={}", query.entityType(), e);
            return load(query, loader);
        }
        return readThrough.getOrSetAsync(key, () -> load(query, loader), ttlMillisFor(query.entityType()));
    }

    public String keyFor(PageQuery query) {
        return cacheKeys.serialize(CacheKeyParts.of(
            query.entityType(), query.filter(), query.sort(), query.page(), query.pageSize()));
    }

    long ttlMillisFor(String entityType) {
        Duration ttl = entityTtl.get(entityType);
        return ttl != null ? ttl.toMillis() : defaultTtlMillis;
    }

    private static <T> CompletableFuture<Page<T>> load(PageQuery query, PageLoader<T> loader) {
        CompletableFuture<PageSlice<T>> slice;
        try {
            slice = loader.load(query.filter(), query.sort(), query.page(), query.pageSize());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return slice.thenApply(result -> Page.of(result, query));
    }
}

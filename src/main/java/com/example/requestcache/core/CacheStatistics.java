package com.example.requestcache.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters owned by a {@link CacheStore}. Callers only ever see {@link CacheStats} snapshots.
 */
class CacheStatistics {

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    void recordHit() {
        hits.incrementAndGet();
    }

    void recordMiss() {
        misses.incrementAndGet();
    }

    void recordSet() {
        sets.incrementAndGet();
    }

    void recordDelete() {
        deletes.incrementAndGet();
    }

    void recordEviction() {
        evictions.incrementAndGet();
    }

    CacheStats snapshot(int size, int maxSize, CacheStats.MemoryUsage memoryUsage) {
        return CacheStats.of(
            hits.get(), misses.get(), sets.get(), deletes.get(), evictions.get(), size, maxSize, memoryUsage);
    }

    void reset() {
        hits.set(0);
        misses.set(0);
        sets.set(0);
        deletes.set(0);
        evictions.set(0);
    }
}

package com.example.requestcache.core;

/**
 * Point-in-time view of the store counters. {@code hitRate} is in [0, 1].
 */
public record CacheStats(
    long hits,
    long misses,
    long sets,
    long deletes,
    long evictions,
    double hitRate,
    int size,
    int maxSize,
    MemoryUsage memoryUsage
) {

    public static CacheStats of(
        long hits, long misses, long sets, long deletes, long evictions, int size, int maxSize, MemoryUsage memoryUsage) {
        long lookups = hits + misses;
        double hitRate = lookups > 0 ? (double) hits / lookups : 0.0;
        return new CacheStats(hits, misses, sets, deletes, evictions, hitRate, size, maxSize, memoryUsage);
    }

    /** Approximate footprint; see {@link SizedValue} for values that report their own size. */
    public record MemoryUsage(long estimatedBytes, double estimatedMB, int entries) {

        public static final MemoryUsage EMPTY = new MemoryUsage(0, 0.0, 0);

        public static MemoryUsage of(long estimatedBytes, int entries) {
            double megabytes = Math.round(estimatedBytes / 1024.0 / 1024.0 * 100) / 100.0;
            return new MemoryUsage(estimatedBytes, megabytes, entries);
        }
    }
}

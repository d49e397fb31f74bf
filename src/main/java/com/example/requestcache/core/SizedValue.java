package com.example.requestcache.core;

/**
 * A cached value that knows its approximate footprint, used for {@link CacheStats.MemoryUsage}.
 */
public interface SizedValue {

    long estimatedBytes();
}

package com.example.requestcache.eviction;

import com.example.requestcache.core.CacheEntry;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the entry to drop when the store is full. Called with the store lock held,
 * so implementations must not call back into the store.
 */
public interface EvictionStrategy {
    Optional<String> selectVictim(Map<String, CacheEntry<Object>> entries);
}

package com.example.requestcache.eviction;

import com.example.requestcache.core.CacheEntry;
import java.util.Map;
import java.util.Optional;

/**
 * Approximate LRU: full scan for the entry with the oldest last access,
 * falling back to creation time for entries that were never read.
 * Equal timestamps are decided by the store's touch sequence, then by iteration order.
 */
public class LruEvictionStrategy implements EvictionStrategy {

    @Override
    public Optional<String> selectVictim(Map<String, CacheEntry<Object>> entries) {
        CacheEntry<Object> oldest = null;
        for (CacheEntry<Object> candidate : entries.values()) {
            if (oldest == null || isOlder(candidate, oldest)) {
                oldest = candidate;
            }
        }
        return oldest == null ? Optional.empty() : Optional.of(oldest.getKey());
    }

    private static boolean isOlder(CacheEntry<Object> candidate, CacheEntry<Object> current) {
        long candidateTime = candidate.lastTouchedAt();
        long currentTime = current.lastTouchedAt();
        if (candidateTime != currentTime) {
            return candidateTime < currentTime;
        }
        return candidate.getTouchSequence() < current.getTouchSequence();
    }
}

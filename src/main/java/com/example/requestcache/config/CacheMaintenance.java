package com.example.requestcache.config;

import com.example.requestcache.core.CacheStats;
import com.example.requestcache.core.CacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background sweep of expired entries and periodic statistics logging.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheMaintenance {

    private final CacheStore cacheStore;
    private final CacheProperties properties;

    @Scheduled(
        fixedDelayString = "${request-cache.cleanup-interval-millis:60000}",
        initialDelayString = "${request-cache.cleanup-interval-millis:60000}")
    public void sweepExpired() {
        int removed = cacheStore.cleanup();
        if (removed > 0) {
            log.debug("Cache sweep removed {} expired entries", removed);
        }
    }

    @Scheduled(
        fixedRateString = "${request-cache.stats-log.interval-millis:300000}",
        initialDelayString = "${request-cache.stats-log.interval-millis:300000}")
    public void logStats() {
        if (!properties.getStatsLog().isEnabled()) {
            return;
        }
        CacheStats stats = cacheStore.getStats();
        log.info("Cache statistics: hits={}, misses={}, sets={}, deletes={}, evictions={}, hitRate={}, size={}/{}, estimatedMB={}",
            stats.hits(), stats.misses(), stats.sets(), stats.deletes(), stats.evictions(),
            String.format("%.2f", stats.hitRate()), stats.size(), stats.maxSize(), stats.memoryUsage().estimatedMB());
    }
}

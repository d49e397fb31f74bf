package com.example.requestcache.core;

import com.example.requestcache.eviction.EvictionStrategy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory key/value store with per-entry TTL, capacity-bound eviction and substring invalidation.
 *
 * <p>All mutations run under one lock, so {@code get}, {@code set}, {@code delete}, {@code cleanup}
 * and eviction are atomic with respect to each other. Expired entries are removed three ways:
 * lazily on read, by a per-entry expiry timer, and by the periodic {@link #cleanup()} sweep.
 *
 * <p>None of the operations throw for ordinary outcomes; a missing key is an empty result and a
 * {@code null} value is simply not stored.
 */
@Slf4j
public class CacheStore implements AutoCloseable {

    private final Map<String, CacheEntry<Object>> entries = new LinkedHashMap<>();
    private final Map<String, ScheduledFuture<?>> timers = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final CacheStatistics statistics = new CacheStatistics();

    private final int maxSize;
    private final long defaultTtlMillis;
    private final EvictionStrategy evictionStrategy;
    private final Clock clock;
    private final ScheduledExecutorService expiryScheduler;
    private final boolean ownsScheduler;

    private long touchSequence;

    public CacheStore(int maxSize, long defaultTtlMillis, EvictionStrategy evictionStrategy, Clock clock) {
        this(maxSize, defaultTtlMillis, evictionStrategy, clock, newExpiryScheduler(), true);
    }

    public CacheStore(
        int maxSize,
        long defaultTtlMillis,
        EvictionStrategy evictionStrategy,
        Clock clock,
        ScheduledExecutorService expiryScheduler
    ) {
        this(maxSize, defaultTtlMillis, evictionStrategy, clock, expiryScheduler, false);
    }

    private CacheStore(
        int maxSize,
        long defaultTtlMillis,
        EvictionStrategy evictionStrategy,
        Clock clock,
        ScheduledExecutorService expiryScheduler,
        boolean ownsScheduler
    ) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, got " + maxSize);
        }
        if (defaultTtlMillis < 0) {
            throw new IllegalArgumentException("defaultTtlMillis must not be negative, got " + defaultTtlMillis);
        }
        this.maxSize = maxSize;
        this.defaultTtlMillis = defaultTtlMillis;
        this.evictionStrategy = evictionStrategy;
        this.clock = clock;
        this.expiryScheduler = expiryScheduler;
        this.ownsScheduler = ownsScheduler;
    }

    public void set(String key, Object value) {
        set(key, value, defaultTtlMillis);
    }

    /**
     * Inserts or replaces an entry. A negative TTL falls back to the default, {@code 0} never expires.
     * Inserting a new key into a full store evicts one entry first.
     */
    public void set(String key, Object value, long ttlMillis) {
        if (key == null || value == null) {
            log.debug("Cache set skipped for null key or value: key={}", key);
            return;
        }
        long ttl = ttlMillis < 0 ? defaultTtlMillis : ttlMillis;

        lock.lock();
        try {
            if (!entries.containsKey(key) && entries.size() >= maxSize) {
                evictLRU();
            }
            cancelTimer(key);

            CacheEntry<Object> entry = new CacheEntry<>(key, value, clock.millis(), ttl, ++touchSequence);
            entries.put(key, entry);
            if (ttl > 0) {
                scheduleExpiry(entry, ttl);
            }
            statistics.recordSet();
            log.debug("Cache set: key={}, ttl={}, size={}", key, ttl, entries.size());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Object> get(String key) {
        if (key == null) {
            statistics.recordMiss();
            return Optional.empty();
        }
        lock.lock();
        try {
            CacheEntry<Object> entry = entries.get(key);
            if (entry == null) {
                statistics.recordMiss();
                log.debug("Cache miss: key={}", key);
                return Optional.empty();
            }

            long now = clock.millis();
            if (entry.isExpired(now)) {
                delete(key);
                statistics.recordMiss();
                log.debug("Cache expired on read: key={}", key);
                return Optional.empty();
            }

            entry.recordAccess(now, ++touchSequence);
            statistics.recordHit();
            log.debug("Cache hit: key={}, accessCount={}", key, entry.getAccessCount());
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    /** Typed read. A value of another type is reported absent; the lookup still counts as a hit. */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    public boolean has(String key) {
        return get(key).isPresent();
    }

    public boolean delete(String key) {
        if (key == null) {
            return false;
        }
        lock.lock();
        try {
            cancelTimer(key);
            boolean existed = entries.remove(key) != null;
            if (existed) {
                statistics.recordDelete();
                log.debug("Cache delete: key={}, size={}", key, entries.size());
            }
            return existed;
        } finally {
            lock.unlock();
        }
    }

    /** Drops every entry and timer. Statistics are kept. */
    public void clear() {
        lock.lock();
        try {
            int previousSize = entries.size();
            timers.values().forEach(timer -> timer.cancel(false));
            timers.clear();
            entries.clear();
            log.info("Cache cleared: previousSize={}", previousSize);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry whose TTL has elapsed, whether or not it was ever read.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        lock.lock();
        try {
            long now = clock.millis();
            List<String> expiredKeys = new ArrayList<>();
            for (CacheEntry<Object> entry : entries.values()) {
                if (entry.isExpired(now)) {
                    expiredKeys.add(entry.getKey());
                }
            }
            expiredKeys.forEach(this::delete);

            if (!expiredKeys.isEmpty()) {
                log.debug("Cache cleanup: expiredCount={}", expiredKeys.size());
            }
            return expiredKeys.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evicts the entry chosen by the eviction strategy.
     *
     * @return the evicted key, empty when the store is empty
     */
    public Optional<String> evictLRU() {
        lock.lock();
        try {
            Optional<String> victim = evictionStrategy.selectVictim(entries);
            victim.ifPresent(victimKey -> {
                delete(victimKey);
                statistics.recordEviction();
                log.debug("Cache LRU eviction: evictedKey={}", victimKey);
            });
            return victim;
        } finally {
            lock.unlock();
        }
    }

    public boolean invalidate(String key) {
        boolean deleted = delete(key);
        if (deleted) {
            log.info("Cache key invalidated: key={}", key);
        }
        return deleted;
    }

    /**
     * Deletes every key containing {@code pattern} as a literal substring.
     * A blank pattern matches nothing; use {@link #clear()} to drop everything.
     *
     * @return number of keys removed
     */
    public int invalidatePattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            log.warn("Cache invalidation ignored for blank pattern");
            return 0;
        }
        lock.lock();
        try {
            List<String> matching = new ArrayList<>();
            for (String key : entries.keySet()) {
                if (key.contains(pattern)) {
                    matching.add(key);
                }
            }
            matching.forEach(this::delete);
            log.info("Cache invalidated: pattern={}, deletedKeys={}", pattern, matching.size());
            return matching.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            return statistics.snapshot(entries.size(), maxSize, MemoryUsageEstimator.estimate(entries.values()));
        } finally {
            lock.unlock();
        }
    }

    public void resetStats() {
        statistics.reset();
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public List<String> keys() {
        lock.lock();
        try {
            return List.copyOf(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int maxSize() {
        return maxSize;
    }

    public long defaultTtlMillis() {
        return defaultTtlMillis;
    }

    @Override
    public void close() {
        clear();
        if (ownsScheduler) {
            expiryScheduler.shutdownNow();
        }
    }

    private void scheduleExpiry(CacheEntry<Object> entry, long delayMillis) {
        try {
            ScheduledFuture<?> timer = expiryScheduler.schedule(
                () -> expire(entry), delayMillis, TimeUnit.MILLISECONDS);
            timers.put(entry.getKey(), timer);
        } catch (RejectedExecutionException e) {
            // scheduler already shut down; lazy expiry and the sweep still apply
            log.warn("Cache expiry timer rejected: key={}", entry.getKey());
        }
    }

    private void expire(CacheEntry<Object> scheduled) {
        lock.lock();
        try {
            String key = scheduled.getKey();
            if (entries.get(key) != scheduled) {
                return;
            }
            long remaining = scheduled.expiresAt() - clock.millis();
            if (remaining > 0) {
                scheduleExpiry(scheduled, remaining);
                return;
            }
            timers.remove(key);
            delete(key);
            log.debug("Cache entry expired: key={}", key);
        } finally {
            lock.unlock();
        }
    }

    private void cancelTimer(String key) {
        ScheduledFuture<?> timer = timers.remove(key);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private static ScheduledExecutorService newExpiryScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = Executors.defaultThreadFactory().newThread(runnable);
            thread.setName("cache-expiry");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}

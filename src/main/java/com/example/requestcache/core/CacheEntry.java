package com.example.requestcache.core;

/**
 * One cached result. Timestamps are epoch millis from the owning store's clock.
 * Only {@link CacheStore} mutates the access fields.
 */
public class CacheEntry<V> {

    private final String key;
    private final V value;
    private final long createdAt;
    private final long ttlMillis;     // 0 means no expiry
    private long accessCount;
    private long lastAccessedAt;      // 0 until the first successful read
    private long touchSequence;       // store-wide order of inserts and reads, breaks timestamp ties

    CacheEntry(String key, V value, long createdAt, long ttlMillis, long touchSequence) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.ttlMillis = ttlMillis;
        this.touchSequence = touchSequence;
    }

    void recordAccess(long now, long sequence) {
        accessCount++;
        lastAccessedAt = now;
        touchSequence = sequence;
    }

    public boolean isExpired(long now) {
        return ttlMillis > 0 && now - createdAt >= ttlMillis;
    }

    public long expiresAt() {
        return ttlMillis > 0 ? createdAt + ttlMillis : Long.MAX_VALUE;
    }

    /** Last read time, or the creation time when the entry was never read. */
    public long lastTouchedAt() {
        return lastAccessedAt > 0 ? lastAccessedAt : createdAt;
    }

    public String getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getTtlMillis() {
        return ttlMillis;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public long getLastAccessedAt() {
        return lastAccessedAt;
    }

    public long getTouchSequence() {
        return touchSequence;
    }
}

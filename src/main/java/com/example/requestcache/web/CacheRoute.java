package com.example.requestcache.web;

import java.time.Duration;
import java.util.Objects;

/**
 * Ant-style path pattern whose responses are cached for {@code ttl}. {@link Duration#ZERO} never expires.
 */
public record CacheRoute(String pattern, Duration ttl) {

    public CacheRoute {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("Route TTL must not be negative: " + pattern);
        }
    }

    public long ttlMillis() {
        return ttl.toMillis();
    }
}

package com.example.requestcache.config;

import java.time.Duration;

/** Named TTLs for cached routes. */
public enum TtlPreset {
    /** Data that changes often. */
    SHORT(Duration.ofMinutes(1)),
    MEDIUM(Duration.ofMinutes(5)),
    LONG(Duration.ofMinutes(30)),
    /** Rarely changing reference data. */
    VERY_LONG(Duration.ofHours(1));

    private final Duration ttl;

    TtlPreset(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getTtl() {
        return ttl;
    }
}

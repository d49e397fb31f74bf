package com.example.requestcache.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Collection;
import lombok.extern.slf4j.Slf4j;

/**
 * Rough footprint of the stored entries: two bytes per key and value character plus a fixed
 * per-entry overhead. Values without a cheaper measure are sized by their JSON form.
 */
@Slf4j
final class MemoryUsageEstimator {

    static final long ENTRY_OVERHEAD_BYTES = 100;

    private static final JsonMapper JSON = JsonMapper.builder()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .build();

    private MemoryUsageEstimator() {
    }

    static CacheStats.MemoryUsage estimate(Collection<CacheEntry<Object>> entries) {
        long total = 0;
        for (CacheEntry<Object> entry : entries) {
            total += entry.getKey().length() * 2L + valueBytes(entry.getValue()) + ENTRY_OVERHEAD_BYTES;
        }
        return CacheStats.MemoryUsage.of(total, entries.size());
    }

    static long valueBytes(Object value) {
        if (value instanceof SizedValue sized) {
            return sized.estimatedBytes();
        }
        if (value instanceof CharSequence text) {
            return text.length() * 2L;
        }
        if (value instanceof byte[] bytes) {
            return bytes.length;
        }
        try {
            return JSON.writeValueAsString(value).length() * 2L;
        } catch (JsonProcessingException e) {
            log.debug("Cache value not measurable, counted as overhead only: type={}", value.getClass().getName());
            return 0;
        }
    }
}

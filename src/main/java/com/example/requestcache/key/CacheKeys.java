package com.example.requestcache.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Serializes {@link CacheKeyParts} into store keys of the form {@code kind:[d1,d2,...]}.
 *
 * <p>Discriminators are written as JSON with map entries and bean properties in sorted order, so
 * two logically equal inputs always produce the same key regardless of map insertion order.
 */
public class CacheKeys {

    private final ObjectMapper mapper;

    public CacheKeys() {
        this.mapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();
    }

    public String serialize(CacheKeyParts parts) {
        try {
            return parts.kind() + ":" + mapper.writeValueAsString(parts.discriminators());
        } catch (JsonProcessingException e) {
            throw new CacheKeyException("Cannot serialize cache key of kind " + parts.kind(), e);
        }
    }
}

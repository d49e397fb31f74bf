package com.example.requestcache.key;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Structured identity of a cached computation: an operation kind plus its ordered discriminators.
 * Discriminators may be {@code null}; position is significant.
 *
 * @see CacheKeys#serialize(CacheKeyParts)
 */
public record CacheKeyParts(String kind, List<Object> discriminators) {

    public CacheKeyParts {
        Objects.requireNonNull(kind, "kind");
        if (kind.isBlank() || kind.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Key kind must be non-blank and contain no ':' but was '" + kind + "'");
        }
        discriminators = Collections.unmodifiableList(new ArrayList<>(discriminators));
    }

    public static CacheKeyParts of(String kind, Object... discriminators) {
        return new CacheKeyParts(kind, Arrays.asList(discriminators));
    }
}

package com.example.requestcache.web;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * After a successful request with one of {@code methods} on a path matching {@code pattern},
 * every cache key containing one of {@code invalidates} is dropped.
 */
public record InvalidationRule(String pattern, Set<String> methods, List<String> invalidates) {

    public static final Set<String> WRITE_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    public InvalidationRule {
        Objects.requireNonNull(pattern, "pattern");
        methods = methods == null || methods.isEmpty()
            ? WRITE_METHODS
            : methods.stream().map(m -> m.toUpperCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        invalidates = List.copyOf(invalidates);
    }
}

package com.example.requestcache.query;

import java.util.Objects;

public record SortSpec(String field, Direction direction) {

    public enum Direction {
        ASC,
        DESC
    }

    public SortSpec {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(direction, "direction");
    }

    public static SortSpec asc(String field) {
        return new SortSpec(field, Direction.ASC);
    }

    public static SortSpec desc(String field) {
        return new SortSpec(field, Direction.DESC);
    }
}

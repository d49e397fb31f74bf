package com.example.requestcache.query;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds normalized {@link PageQuery}s from raw request parameters.
 *
 * <p>{@code page} is at least 1, {@code limit} is clamped to {@code [1, maxLimit]}, an unknown
 * {@code order} falls back to the default, and a {@code sortBy} outside the entity's allowed fields
 * is rejected. Remaining parameters become filters; when filter fields are configured for the
 * entity only those are kept.
 */
public class PageQueryFactory {

    public static final String PAGE = "page";
    public static final String LIMIT = "limit";
    public static final String SORT_BY = "sortBy";
    public static final String ORDER = "order";

    private static final Set<String> RESERVED = Set.of(PAGE, LIMIT, SORT_BY, ORDER);

    private final int defaultLimit;
    private final int maxLimit;
    private final String defaultSort;
    private final SortSpec.Direction defaultOrder;
    private final Map<String, List<String>> allowedSortFields;
    private final Map<String, List<String>> filterFields;

    public PageQueryFactory(
        int defaultLimit,
        int maxLimit,
        String defaultSort,
        SortSpec.Direction defaultOrder,
        Map<String, List<String>> allowedSortFields,
        Map<String, List<String>> filterFields
    ) {
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
        this.defaultSort = defaultSort;
        this.defaultOrder = defaultOrder;
        this.allowedSortFields = new HashMap<>(allowedSortFields);
        this.filterFields = new HashMap<>(filterFields);
    }

    public PageQuery create(String entityType, Map<String, String> params) {
        int page = Math.max(1, parseOr(params.get(PAGE), 1));
        int limit = Math.min(maxLimit, Math.max(1, parseOr(params.get(LIMIT), defaultLimit)));

        String sortBy = blankToNull(params.get(SORT_BY));
        if (sortBy == null) {
            sortBy = defaultSort;
        }
        List<String> allowed = allowedSortFields.getOrDefault(entityType, List.of());
        if (!allowed.isEmpty() && !allowed.contains(sortBy)) {
            throw new IllegalArgumentException(
                "Invalid sort field '" + sortBy + "'. Allowed fields: " + String.join(", ", allowed));
        }

        return new PageQuery(entityType, filters(entityType, params), new SortSpec(sortBy, order(params.get(ORDER))), page, limit);
    }

    private Map<String, Object> filters(String entityType, Map<String, String> params) {
        List<String> fields = filterFields.getOrDefault(entityType, List.of());
        Map<String, Object> filter = new TreeMap<>();
        params.forEach((name, value) -> {
            if (RESERVED.contains(name) || blankToNull(value) == null) {
                return;
            }
            if (fields.isEmpty() || fields.contains(name)) {
                filter.put(name, value);
            }
        });
        return filter;
    }

    private SortSpec.Direction order(String raw) {
        if (raw == null) {
            return defaultOrder;
        }
        try {
            return SortSpec.Direction.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultOrder;
        }
    }

    private static int parseOr(String raw, int fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

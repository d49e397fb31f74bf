package com.example.requestcache.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageQueryFactoryTest {

    private final PageQueryFactory factory = new PageQueryFactory(
        10,
        100,
        "id",
        SortSpec.Direction.ASC,
        Map.of("products", List.of("id", "name", "price")),
        Map.of("products", List.of("brand", "status")));

    @Test
    @DisplayName("missing parameters fall back to defaults")
    void shouldApplyDefaults() {
        PageQuery query = factory.create("products", Map.of());

        assertThat(query.page()).isEqualTo(1);
        assertThat(query.pageSize()).isEqualTo(10);
        assertThat(query.sort()).isEqualTo(SortSpec.asc("id"));
        assertThat(query.filter()).isEmpty();
    }

    @Test
    @DisplayName("page and limit are clamped into range")
    void shouldClampPageAndLimit() {
        assertThat(factory.create("products", Map.of("page", "0", "limit", "500")))
            .satisfies(q -> {
                assertThat(q.page()).isEqualTo(1);
                assertThat(q.pageSize()).isEqualTo(100);
            });
        assertThat(factory.create("products", Map.of("page", "-3", "limit", "0")))
            .satisfies(q -> {
                assertThat(q.page()).isEqualTo(1);
                assertThat(q.pageSize()).isEqualTo(1);
            });
        assertThat(factory.create("products", Map.of("page", "abc", "limit", "x")).pageSize()).isEqualTo(10);
    }

    @Test
    @DisplayName("order is case-insensitive and unknown values use the default")
    void shouldParseOrder() {
        assertThat(factory.create("products", Map.of("sortBy", "price", "order", "desc")).sort())
            .isEqualTo(SortSpec.desc("price"));
        assertThat(factory.create("products", Map.of("order", "sideways")).sort().direction())
            .isEqualTo(SortSpec.Direction.ASC);
    }

    @Test
    @DisplayName("sort field outside the allowed list is rejected")
    void shouldRejectDisallowedSort() {
        assertThatThrownBy(() -> factory.create("products", Map.of("sortBy", "password")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("password");
    }

    @Test
    @DisplayName("entities without an allowed list accept any sort field")
    void shouldAcceptAnySortWhenUnconfigured() {
        assertThat(factory.create("orders", Map.of("sortBy", "createdAt")).sort().field()).isEqualTo("createdAt");
    }

    @Test
    @DisplayName("only configured, non-blank filter fields are kept")
    void shouldKeepConfiguredFilters() {
        Map<String, String> params = new HashMap<>();
        params.put("page", "2");
        params.put("brand", "acme");
        params.put("status", " ");
        params.put("internal", "yes");

        PageQuery query = factory.create("products", params);

        assertThat(query.filter()).containsExactly(Map.entry("brand", "acme"));
    }

    @Test
    @DisplayName("entities without filter fields keep every non-reserved parameter")
    void shouldKeepAllFiltersWhenUnconfigured() {
        PageQuery query = factory.create("orders", Map.of("limit", "5", "status", "open", "customer", "42"));

        assertThat(query.filter()).containsOnlyKeys("customer", "status");
    }
}

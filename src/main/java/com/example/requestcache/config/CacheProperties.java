package com.example.requestcache.config;

import com.example.requestcache.query.SortSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Construction-time settings of the cache ({@code request-cache.*}).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "request-cache")
public class CacheProperties {

    /** TTL used when a caller does not pass one. {@code 0} disables expiry. */
    @NotNull private Duration defaultTtl = Duration.ofMinutes(5);

    @Min(1) private int maxSize = 1000;

    /** Period of the expired-entry sweep. */
    @Min(1) private long cleanupIntervalMillis = 60_000;

    @Valid @NotNull private StatsLog statsLog = new StatsLog();

    /** Per-entity TTL for paginated listings, keyed by entity type. */
    @NotNull private Map<String, Duration> entityTtl = defaultEntityTtl();

    /** Cached request paths, first match wins. */
    @Valid @NotNull private List<Route> routes = new ArrayList<>();

    /** Cache flushes triggered by successful writes. */
    @Valid @NotNull private List<Invalidation> invalidation = new ArrayList<>();

    @Valid @NotNull private Pagination pagination = new Pagination();

    @Valid @NotNull private Admin admin = new Admin();

    @Getter
    @Setter
    public static class StatsLog {

        private boolean enabled = true;

        @Min(1) private long intervalMillis = 300_000;
    }

    @Getter
    @Setter
    public static class Route {

        @NotBlank private String pattern;

        /** Explicit TTL; overrides {@link #preset} when set. */
        private Duration ttl;

        @NotNull private TtlPreset preset = TtlPreset.MEDIUM;

        public Duration resolveTtl() {
            return ttl != null ? ttl : preset.getTtl();
        }
    }

    @Getter
    @Setter
    public static class Invalidation {

        @NotBlank private String pattern;

        /** HTTP methods that trigger the flush; empty means all write methods. */
        private List<String> methods = new ArrayList<>();

        @NotEmpty private List<String> invalidates = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Pagination {

        @Min(1) private int defaultLimit = 10;

        @Min(1) private int maxLimit = 100;

        @NotBlank private String defaultSort = "id";

        @NotNull private SortSpec.Direction defaultOrder = SortSpec.Direction.ASC;

        private Map<String, List<String>> allowedSortFields = new LinkedHashMap<>();

        private Map<String, List<String>> filterFields = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Admin {

        /** Exposes {@code POST /cache/clear}. Keep off in production. */
        private boolean clearEnabled = false;
    }

    private static Map<String, Duration> defaultEntityTtl() {
        Map<String, Duration> ttl = new LinkedHashMap<>();
        ttl.put("products", Duration.ofMinutes(5));
        ttl.put("categories", Duration.ofMinutes(10));
        ttl.put("users", Duration.ofMinutes(5));
        ttl.put("orders", Duration.ofMinutes(3));
        ttl.put("dashboard", Duration.ofMinutes(2));
        ttl.put("statistics", Duration.ofMinutes(10));
        ttl.put("search", Duration.ofMinutes(4));
        return ttl;
    }
}

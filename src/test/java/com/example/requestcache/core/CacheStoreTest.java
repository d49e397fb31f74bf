package com.example.requestcache.core;

import com.example.requestcache.eviction.LruEvictionStrategy;
import com.example.requestcache.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CacheStoreTest {

    private static final long DEFAULT_TTL = 300_000;

    private MutableClock clock;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> timer;
    private CacheStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        scheduler = mock(ScheduledExecutorService.class);
        timer = mock(ScheduledFuture.class);
        doReturn(timer).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        store = newStore(1000);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private CacheStore newStore(int maxSize) {
        return new CacheStore(maxSize, DEFAULT_TTL, new LruEvictionStrategy(), clock, scheduler);
    }

    @Nested
    @DisplayName("set / get")
    class SetGetTest {

        @Test
        @DisplayName("value is readable right after set")
        void shouldReturnValueBeforeTtlElapses() {
            store.set("orders:page:1", List.of("A", "B"), 1000);

            assertThat(store.get("orders:page:1")).contains(List.of("A", "B"));
        }

        @Test
        @DisplayName("entry is absent once its TTL has elapsed and the miss is counted")
        void shouldExpireOnRead() {
            store.set("orders:page:1", List.of("A", "B"), 1000);
            assertThat(store.get("orders:page:1")).contains(List.of("A", "B"));
            long missesBefore = store.getStats().misses();

            clock.advanceMillis(1100);

            assertThat(store.get("orders:page:1")).isEmpty();
            assertThat(store.getStats().misses()).isEqualTo(missesBefore + 1);
            assertThat(store.has("orders:page:1")).isFalse();
            assertThat(store.size()).isZero();
        }

        @Test
        @DisplayName("entry expires exactly when its TTL is reached")
        void shouldTreatTtlBoundaryAsExpired() {
            store.set("k", "v", 1000);

            clock.advanceMillis(999);
            assertThat(store.has("k")).isTrue();

            clock.advanceMillis(1);
            assertThat(store.has("k")).isFalse();
        }

        @Test
        @DisplayName("TTL 0 never expires and schedules no timer")
        void shouldKeepEntryWithoutTtl() {
            store.set("k", "v", 0);

            clock.advanceMillis(TimeUnit.DAYS.toMillis(365));

            assertThat(store.get("k")).contains("v");
            verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        }

        @Test
        @DisplayName("set without TTL and negative TTL use the default")
        void shouldApplyDefaultTtl() {
            store.set("a", 1);
            store.set("b", 2, -5);

            clock.advanceMillis(DEFAULT_TTL - 1);
            assertThat(store.has("a")).isTrue();
            assertThat(store.has("b")).isTrue();

            clock.advanceMillis(1);
            assertThat(store.has("a")).isFalse();
            assertThat(store.has("b")).isFalse();
        }

        @Test
        @DisplayName("get on an absent key is a miss, not an error")
        void shouldReportMissForAbsentKey() {
            assertThat(store.get("missing")).isEmpty();
            assertThat(store.get(null)).isEmpty();

            assertThat(store.getStats().misses()).isEqualTo(2);
        }

        @Test
        @DisplayName("typed get reports a value of another type as absent")
        void shouldFilterByType() {
            store.set("k", "text");

            assertThat(store.get("k", String.class)).contains("text");
            assertThat(store.get("k", Integer.class)).isEmpty();
        }

        @Test
        @DisplayName("null values are not stored")
        void shouldIgnoreNullValue() {
            store.set("k", null);

            assertThat(store.size()).isZero();
            assertThat(store.getStats().sets()).isZero();
        }

        @Test
        @DisplayName("hit updates the access bookkeeping used by eviction")
        void shouldCountHits() {
            store.set("k", "v");

            store.get("k");
            store.get("k");

            CacheStats stats = store.getStats();
            assertThat(stats.hits()).isEqualTo(2);
            assertThat(stats.sets()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("delete / clear")
    class DeleteTest {

        @Test
        @DisplayName("deleting twice yields true then false")
        void shouldBeIdempotent() {
            store.set("k", "v");

            assertThat(store.delete("k")).isTrue();
            assertThat(store.delete("k")).isFalse();
            assertThat(store.delete(null)).isFalse();
            assertThat(store.getStats().deletes()).isEqualTo(1);
        }

        @Test
        @DisplayName("delete cancels the pending expiry timer")
        void shouldCancelTimerOnDelete() {
            store.set("k", "v", 1000);

            store.delete("k");

            verify(timer).cancel(false);
        }

        @Test
        @DisplayName("clear empties the store but keeps statistics")
        void shouldClearEntriesOnly() {
            store.set("a", 1, 1000);
            store.set("b", 2, 1000);
            store.get("a");

            store.clear();

            assertThat(store.size()).isZero();
            assertThat(store.keys()).isEmpty();
            verify(timer, times(2)).cancel(false);
            CacheStats stats = store.getStats();
            assertThat(stats.sets()).isEqualTo(2);
            assertThat(stats.hits()).isEqualTo(1);
        }

        @Test
        @DisplayName("resetStats zeroes every counter")
        void shouldResetStats() {
            store.set("a", 1);
            store.get("a");
            store.get("b");

            store.resetStats();

            CacheStats stats = store.getStats();
            assertThat(stats.hits()).isZero();
            assertThat(stats.misses()).isZero();
            assertThat(stats.sets()).isZero();
            assertThat(stats.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("capacity and LRU eviction")
    class EvictionTest {

        @Test
        @DisplayName("least recently accessed entry is evicted when a new key arrives")
        void shouldEvictLeastRecentlyUsed() {
            CacheStore small = newStore(2);
            small.set("a", 1);
            small.set("b", 2);
            small.get("a");

            small.set("c", 3);

            assertThat(small.has("b")).isFalse();
            assertThat(small.has("a")).isTrue();
            assertThat(small.has("c")).isTrue();
            assertThat(small.getStats().evictions()).isEqualTo(1);
        }

        @Test
        @DisplayName("never-read entries are ordered by creation time")
        void shouldFallBackToCreationTime() {
            CacheStore small = newStore(2);
            small.set("old", 1);
            clock.advanceMillis(10);
            small.set("new", 2);
            clock.advanceMillis(10);

            small.set("newest", 3);

            assertThat(small.keys()).containsExactlyInAnyOrder("new", "newest");
        }

        @Test
        @DisplayName("replacing an existing key in a full store evicts nothing")
        void shouldNotEvictOnReplace() {
            CacheStore small = newStore(2);
            small.set("a", 1);
            small.set("b", 2);

            small.set("a", 10);

            assertThat(small.size()).isEqualTo(2);
            assertThat(small.getStats().evictions()).isZero();
            assertThat(small.get("a")).contains(10);
        }

        @Test
        @DisplayName("size never exceeds maxSize and each overflow evicts exactly once")
        void shouldHoldCapacityInvariant() {
            CacheStore small = newStore(3);

            for (int i = 0; i < 20; i++) {
                small.set("key-" + i, i);
                assertThat(small.size()).isLessThanOrEqualTo(3);
            }

            assertThat(small.getStats().evictions()).isEqualTo(17);
        }

        @Test
        @DisplayName("evictLRU on an empty store does nothing")
        void shouldHandleEmptyStore() {
            assertThat(store.evictLRU()).isEmpty();
            assertThat(store.getStats().evictions()).isZero();
        }

        @Test
        @DisplayName("maxSize below 1 is rejected at construction")
        void shouldRejectInvalidMaxSize() {
            assertThatThrownBy(() -> newStore(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("expiry timers and sweep")
    class ExpiryTest {

        @Test
        @DisplayName("timer removes the entry after its TTL")
        void shouldRemoveOnTimer() {
            store.set("k", "v", 1000);
            Runnable expiry = capturedExpiry(1);

            clock.advanceMillis(1000);
            expiry.run();

            assertThat(store.size()).isZero();
        }

        @Test
        @DisplayName("re-setting a key cancels the old timer and the stale timer leaves the new entry alone")
        void shouldIgnoreStaleTimer() {
            store.set("k", "v1", 1000);
            Runnable firstExpiry = capturedExpiry(1);

            store.set("k", "v2", 1000);
            verify(timer).cancel(false);

            clock.advanceMillis(1000);
            firstExpiry.run();

            assertThat(store.keys()).containsExactly("k");
        }

        @Test
        @DisplayName("timer that fires before the clock reaches expiry reschedules for the remainder")
        void shouldRescheduleEarlyTimer() {
            store.set("k", "v", 1000);
            Runnable expiry = capturedExpiry(1);

            clock.advanceMillis(400);
            expiry.run();

            assertThat(store.keys()).containsExactly("k");
            verify(scheduler).schedule(any(Runnable.class), eq(600L), eq(TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("cleanup removes every elapsed entry, read or not")
        void shouldSweepExpiredEntries() {
            store.set("short-1", 1, 100);
            store.set("short-2", 2, 100);
            store.set("long", 3, 10_000);
            store.set("forever", 4, 0);

            clock.advanceMillis(500);

            assertThat(store.cleanup()).isEqualTo(2);
            assertThat(store.keys()).containsExactlyInAnyOrder("long", "forever");
        }

        private Runnable capturedExpiry(int invocations) {
            ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
            verify(scheduler, times(invocations)).schedule(captor.capture(), anyLong(), any(TimeUnit.class));
            return captor.getValue();
        }
    }

    @Nested
    @DisplayName("invalidation")
    class InvalidationTest {

        @Test
        @DisplayName("invalidatePattern removes exactly the keys containing the substring")
        void shouldRemoveMatchingKeysOnly() {
            store.set("products:list:1", 1);
            store.set("http:GET:/api/products/42", 2);
            store.set("categories:list:1", 3);
            store.set("orders:list:1", 4);

            int removed = store.invalidatePattern("products");

            assertThat(removed).isEqualTo(2);
            assertThat(store.keys()).containsExactlyInAnyOrder("categories:list:1", "orders:list:1");
        }

        @Test
        @DisplayName("substring matching also reaches longer tokens sharing the prefix")
        void shouldMatchSubstringAcrossTokens() {
            store.set("order:1", 1);
            store.set("order_item:1", 2);

            assertThat(store.invalidatePattern("order")).isEqualTo(2);
        }

        @Test
        @DisplayName("blank pattern removes nothing")
        void shouldIgnoreBlankPattern() {
            store.set("a", 1);

            assertThat(store.invalidatePattern("")).isZero();
            assertThat(store.invalidatePattern(null)).isZero();
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("invalidate removes one exact key")
        void shouldInvalidateExactKey() {
            store.set("product_42", 1);
            store.set("product_420", 2);

            assertThat(store.invalidate("product_42")).isTrue();
            assertThat(store.invalidate("product_42")).isFalse();
            assertThat(store.keys()).containsExactly("product_420");
        }
    }

    @Test
    @DisplayName("memory usage estimates two bytes per character plus per-entry overhead")
    void shouldEstimateMemoryUsage() {
        SizedValue sized = () -> 40;
        store.set("ab", "xyz");
        store.set("n", List.of(1, 2));
        store.set("s", sized);

        CacheStats.MemoryUsage usage = store.getStats().memoryUsage();

        assertThat(usage.entries()).isEqualTo(3);
        assertThat(usage.estimatedBytes()).isEqualTo((4 + 6 + 100) + (2 + 10 + 100) + (2 + 40 + 100));
        assertThat(usage.estimatedMB()).isZero();
    }

    @Test
    @DisplayName("close clears entries and leaves an injected scheduler running")
    void shouldCloseWithoutShuttingDownInjectedScheduler() {
        store.set("k", "v", 1000);

        store.close();

        assertThat(store.size()).isZero();
        verify(scheduler, never()).shutdownNow();
    }
}

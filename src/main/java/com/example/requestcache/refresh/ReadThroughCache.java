package com.example.requestcache.refresh;

import com.example.requestcache.core.CacheStore;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-through access over a {@link CacheStore}: return the cached value, or run the producer once
 * and cache what it returns.
 *
 * <p>Concurrent misses on the same key are coalesced. The first caller runs the producer, later
 * callers wait on the same in-flight future instead of producing again. Producer failures reach
 * every waiting caller unchanged and nothing is cached.
 */
@Slf4j
public class ReadThroughCache {

    private final CacheStore store;
    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public ReadThroughCache(CacheStore store) {
        this.store = store;
    }

    public <T> T getOrSet(String key, Callable<T> producer) throws Exception {
        return getOrSet(key, producer, store.defaultTtlMillis());
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrSet(String key, Callable<T> producer, long ttlMillis) throws Exception {
        Optional<Object> cached = lookup(key);
        if (cached.isPresent()) {
            return (T) cached.get();
        }

        CompletableFuture<Object> pending = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, pending);
        if (existing != null) {
            return (T) await(existing);
        }

        T value;
        try {
            value = producer.call();
        } catch (Throwable e) {
            log.error("Cache getOrSet producer failed: key={}, error={}", key, e.toString());
            inFlight.remove(key, pending);
            pending.completeExceptionally(e);
            throw e;
        }

        storeQuietly(key, value, ttlMillis);
        inFlight.remove(key, pending);
        pending.complete(value);
        return value;
    }

    public <T> CompletableFuture<T> getOrSetAsync(String key, Supplier<CompletableFuture<T>> producer) {
        return getOrSetAsync(key, producer, store.defaultTtlMillis());
    }

    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> getOrSetAsync(String key, Supplier<CompletableFuture<T>> producer, long ttlMillis) {
        Optional<Object> cached = lookup(key);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture((T) cached.get());
        }

        CompletableFuture<Object> pending = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, pending);
        if (existing != null) {
            return follow(existing);
        }

        CompletableFuture<T> produced;
        try {
            produced = producer.get();
        } catch (RuntimeException e) {
            produced = CompletableFuture.failedFuture(e);
        }
        if (produced == null) {
            produced = CompletableFuture.failedFuture(
                new IllegalStateException("Producer returned no future for key " + key));
        }

        produced.whenComplete((value, error) -> {
            inFlight.remove(key, pending);
            if (error != null) {
                Throwable cause = unwrap(error);
                log.error("Cache getOrSet producer failed: key={}, error={}", key, cause.toString());
                pending.completeExceptionally(cause);
                return;
            }
            storeQuietly(key, value, ttlMillis);
            pending.complete(value);
        });
        return follow(pending);
    }

    /** Number of producer calls currently running. */
    public int inFlightCount() {
        return inFlight.size();
    }

    private Optional<Object> lookup(String key) {
        try {
            return store.get(key);
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed, treating as miss: key={}", key, e);
            return Optional.empty();
        }
    }

    private void storeQuietly(String key, Object value, long ttlMillis) {
        try {
            store.set(key, value, ttlMillis);
        } catch (RuntimeException e) {
            log.warn("Cache store failed, value returned uncached: key={}", key, e);
        }
    }

    private static Object await(CompletableFuture<Object> future) throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> CompletableFuture<T> follow(CompletableFuture<Object> source) {
        CompletableFuture<T> result = new CompletableFuture<>();
        source.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete((T) value);
            }
        });
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}

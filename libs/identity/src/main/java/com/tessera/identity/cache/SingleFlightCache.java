package com.tessera.identity.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tessera.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyed cache that runs at most one load per key at a time.
 *
 * <p>Each key maps to an in-flight or completed {@link CompletableFuture}. A caller that misses
 * atomically installs its own future with {@code putIfAbsent} and runs the loader on its own
 * thread; every concurrent caller for the same key finds that future and waits for it. Entries
 * are bounded by a Caffeine cache ({@code expireAfterWrite}, {@code maximumSize}).
 *
 * <p>Rules:
 * <ul>
 *   <li>A loader returning null yields null to every waiter and is not cached.</li>
 *   <li>A loader failure is rethrown to every waiter and is not cached.</li>
 *   <li>{@link #invalidate(Object)} detaches the current entry. A load already in flight still
 *       completes for its waiters but is never re-attached, so the next caller loads again.</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 */
public class SingleFlightCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(SingleFlightCache.class);

    private final String name;
    private final ConcurrentMap<K, CompletableFuture<V>> entries;
    private final Counter hits;
    private final Counter misses;
    private final Counter loadFailures;

    /**
     * @param name         cache name, used as the {@code cache} tag of its metrics
     * @param ttl          how long a completed entry stays valid after it was loaded
     * @param maximumSize  maximum number of entries kept
     * @param metrics      factory for the hit, miss and failure counters
     */
    public SingleFlightCache(String name, Duration ttl, long maximumSize, MetricFactory metrics) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.name = name;
        Cache<K, CompletableFuture<V>> cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
        this.entries = cache.asMap();
        this.hits = metrics.counter("cache.hits", "Lookups served by an existing entry", "cache", name);
        this.misses = metrics.counter("cache.misses", "Lookups that ran the loader", "cache", name);
        this.loadFailures = metrics.counter("cache.load.failures", "Loader invocations that threw", "cache", name);
    }

    /**
     * Returns the cached value for the key, loading it if absent.
     *
     * @param key    the key
     * @param loader computes the value on a miss; may return null
     * @return the value, or null when the loader produced none
     */
    public V get(K key, Function<? super K, ? extends V> loader) {
        CompletableFuture<V> started = new CompletableFuture<>();
        CompletableFuture<V> existing = entries.putIfAbsent(key, started);
        if (existing != null) {
            hits.increment();
            return await(existing);
        }

        misses.increment();
        V value;
        try {
            value = loader.apply(key);
        } catch (RuntimeException | Error e) {
            loadFailures.increment();
            entries.remove(key, started);
            started.completeExceptionally(e);
            log.warn("Loading cache '{}' entry {} failed", name, key, e);
            throw e;
        }
        if (value == null) {
            entries.remove(key, started);
        }
        started.complete(value);
        return value;
    }

    /** Detaches the entry for the key. */
    public void invalidate(K key) {
        entries.remove(key);
    }

    /** Detaches every entry whose key matches. */
    public void invalidateIf(Predicate<? super K> keyFilter) {
        entries.keySet().removeIf(keyFilter);
    }

    /** Detaches every entry. */
    public void invalidateAll() {
        entries.clear();
    }

    /** Whether an entry (in flight or completed) exists for the key. */
    public boolean contains(K key) {
        return entries.containsKey(key);
    }

    /** Approximate number of entries. */
    public long estimatedSize() {
        return entries.size();
    }

    public String name() {
        return name;
    }

    private static <V> V await(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}

package com.ryuqq.toolgate.adapter.inmemory.cache;

import com.ryuqq.toolgate.core.clock.Clock;
import com.ryuqq.toolgate.core.clock.SystemClock;
import com.ryuqq.toolgate.core.error.Failures;
import com.ryuqq.toolgate.core.spi.Cache;
import com.ryuqq.toolgate.core.spi.CacheConfig;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-memory LRU cache with optional TTL, implementing {@link Cache}.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> insertion-ordered LinkedHashMap; a hit is re-inserted so the head
 *       is always the least recently used entry and the tail the most recently used</li>
 *   <li><strong>inFlight:</strong> ConcurrentHashMap&lt;K, CompletableFuture&lt;V&gt;&gt; of pending
 *       {@link #getOrSet(Object, Supplier)} computations shared by concurrent callers</li>
 * </ul>
 *
 * <p><strong>Expiry:</strong> lazy. {@link #get(Object)} purges an expired hit, {@link #prune()}
 * sweeps all entries, {@link #has(Object)} reports false but leaves the entry in place.</p>
 *
 * <p><strong>Thread Safety:</strong> map operations are synchronized on the instance.
 * Factories run outside the monitor.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * BoundedCache&lt;String, ModelInfo&gt; cache = new BoundedCache&lt;&gt;(CacheConfig.of(500, 3_600_000));
 *
 * cache.getOrSet(air, () -&gt; client.searchModel(air))
 *     .thenAccept(model -&gt; ...);
 * </pre>
 *
 * @param <K> key type
 * @param <V> value type (null values are rejected)
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class BoundedCache<K, V> implements Cache<K, V> {

    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final long MAX_TTL_MS = Long.MAX_VALUE / NANOS_PER_MILLI;

    private final CacheConfig config;
    private final Clock clock;
    private final LinkedHashMap<K, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final ConcurrentHashMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    /**
     * Creates a cache on the system clock.
     *
     * @param config cache configuration
     */
    public BoundedCache(CacheConfig config) {
        this(config, SystemClock.instance());
    }

    /**
     * Creates a cache with an explicit clock.
     *
     * @param config cache configuration
     * @param clock monotonic clock used for TTL
     * @throws IllegalArgumentException if config or clock is null
     */
    public BoundedCache(CacheConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public synchronized Optional<V> get(K key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.nowNanos())) {
            entries.remove(key);
            return Optional.empty();
        }
        entries.remove(key);
        entries.put(key, entry);
        return Optional.of(entry.value());
    }

    @Override
    public void set(K key, V value) {
        if (config.hasTtl()) {
            put(key, value, config.ttlMs());
        } else {
            put(key, value, null);
        }
    }

    @Override
    public void set(K key, V value, long ttlMs) {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive (current: " + ttlMs + ")");
        }
        put(key, value, ttlMs);
    }

    @Override
    public synchronized boolean has(K key) {
        CacheEntry<V> entry = entries.get(key);
        return entry != null && !entry.isExpired(clock.nowNanos());
    }

    @Override
    public synchronized boolean delete(K key) {
        return entries.remove(key) != null;
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }

    @Override
    public synchronized List<V> values() {
        List<V> values = new ArrayList<>(entries.size());
        for (CacheEntry<V> entry : entries.values()) {
            values.add(entry.value());
        }
        return values;
    }

    @Override
    public synchronized int prune() {
        long now = clock.nowNanos();
        int removed = 0;
        Iterator<Map.Entry<K, CacheEntry<V>>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getValue().isExpired(now)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The first caller on a miss becomes the leader and runs the factory</li>
     *   <li>Callers arriving while the computation is pending receive a copy of the same result</li>
     *   <li>The value is stored before the in-flight slot is released, so later callers see
     *       either the pending computation or the cached value</li>
     *   <li>A failed computation is not cached; every waiting caller sees the original error</li>
     * </ul>
     */
    @Override
    public CompletableFuture<V> getOrSet(K key, Supplier<CompletableFuture<V>> factory) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }

        CompletableFuture<V> created = new CompletableFuture<>();
        CompletableFuture<V> pending = inFlight.putIfAbsent(key, created);
        if (pending != null) {
            return pending.copy();
        }

        Optional<V> raced = get(key);
        if (raced.isPresent()) {
            inFlight.remove(key, created);
            created.complete(raced.get());
            return created.copy();
        }

        CompletableFuture<V> source;
        try {
            source = factory.get();
            if (source == null) {
                source = CompletableFuture.failedFuture(
                    new IllegalStateException("factory returned null future for key " + key));
            }
        } catch (RuntimeException e) {
            source = CompletableFuture.failedFuture(e);
        }

        source.whenComplete((value, error) -> {
            Throwable failure = error == null ? null : Failures.unwrap(error);
            if (failure == null && value == null) {
                failure = new IllegalStateException("factory produced null value for key " + key);
            }
            if (failure == null) {
                set(key, value);
            }
            inFlight.remove(key, created);
            if (failure == null) {
                created.complete(value);
            } else {
                created.completeExceptionally(failure);
            }
        });
        return created.copy();
    }

    @Override
    public V getOrSetSync(K key, Supplier<V> factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = factory.get();
        if (value == null) {
            throw new IllegalStateException("factory produced null value for key " + key);
        }
        set(key, value);
        return value;
    }

    /**
     * Number of {@link #getOrSet(Object, Supplier)} computations currently pending.
     *
     * @return in-flight computation count
     */
    public int getInFlightCount() {
        return inFlight.size();
    }

    /**
     * Returns the configuration this cache was created with.
     *
     * @return cache configuration
     */
    public CacheConfig getConfig() {
        return config;
    }

    private synchronized void put(K key, V value, Long ttlMs) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        entries.remove(key);

        Iterator<K> eldest = entries.keySet().iterator();
        while (entries.size() >= config.maxSize() && eldest.hasNext()) {
            eldest.next();
            eldest.remove();
        }

        // TTLs beyond the nanosecond range never expire in practice
        CacheEntry<V> entry = ttlMs == null || ttlMs > MAX_TTL_MS
            ? CacheEntry.permanent(value)
            : CacheEntry.expiring(value, clock.nowNanos() + ttlMs * NANOS_PER_MILLI);
        entries.put(key, entry);
    }
}

package com.ryuqq.toolgate.testkit.contract;

import com.ryuqq.toolgate.core.clock.Clock;
import com.ryuqq.toolgate.core.spi.Cache;
import com.ryuqq.toolgate.core.spi.CacheConfig;
import com.ryuqq.toolgate.testkit.time.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link Cache} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Read after write, TTL expiry and lazy purge</li>
 *   <li>LRU eviction order</li>
 *   <li>Read-through with {@code getOrSet}/{@code getOrSetSync}</li>
 * </ul>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public abstract class AbstractCacheContractTest {

    protected ManualClock clock;

    /**
     * Creates the implementation under test.
     *
     * @param config cache configuration
     * @param clock clock used for TTL
     * @return empty cache
     */
    protected abstract Cache<String, String> createCache(CacheConfig config, Clock clock);

    @BeforeEach
    void setUpClock() {
        clock = new ManualClock();
    }

    @Test
    void testSetThenGet_ReturnsValue() {
        // Given
        Cache<String, String> cache = createCache(CacheConfig.of(10), clock);

        // When
        cache.set("k", "v");

        // Then
        assertEquals(Optional.of("v"), cache.get("k"));
        assertTrue(cache.has("k"));
        assertEquals(1, cache.size());
    }

    @Test
    void testGet_MissReturnsEmpty() {
        Cache<String, String> cache = createCache(CacheConfig.of(10), clock);

        assertEquals(Optional.empty(), cache.get("absent"));
        assertFalse(cache.has("absent"));
    }

    @Test
    void testTtl_ExpiredEntryPurgedOnGet() {
        // Given
        Cache<String, String> cache = createCache(CacheConfig.of(10, 1000), clock);
        cache.set("k", "v");

        // When
        clock.advanceMillis(999);
        Optional<String> beforeExpiry = cache.get("k");
        clock.advanceMillis(1);

        // Then
        assertEquals(Optional.of("v"), beforeExpiry);
        assertFalse(cache.has("k"), "expired entry reports false");
        assertEquals(1, cache.size(), "has() leaves the expired entry in place");
        assertEquals(Optional.empty(), cache.get("k"));
        assertEquals(0, cache.size(), "get() purges the expired entry");
    }

    @Test
    void testTtl_PruneRemovesExpiredEntries() {
        // Given
        Cache<String, String> cache = createCache(CacheConfig.of(10, 1000), clock);
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3", 5000);

        // When
        clock.advanceMillis(1000);
        int removed = cache.prune();

        // Then
        assertEquals(2, removed);
        assertEquals(List.of("c"), cache.keys());
    }

    @Test
    void testTtl_OverrideReplacesDefault() {
        // Given
        Cache<String, String> cache = createCache(CacheConfig.of(10, 1000), clock);
        cache.set("k", "v", 3000);

        // When
        clock.advanceMillis(2000);

        // Then
        assertEquals(Optional.of("v"), cache.get("k"));
    }

    @Test
    void testNoTtl_EntriesNeverExpire() {
        Cache<String, String> cache = createCache(CacheConfig.of(10), clock);
        cache.set("k", "v");

        clock.advanceMillis(365L * 24 * 60 * 60 * 1000);

        assertEquals(Optional.of("v"), cache.get("k"));
        assertEquals(0, cache.prune());
    }

    @Test
    void testLru_EvictsLeastRecentlyTouched() {
        // Given
        Cache<String, String> cache = createCache(CacheConfig.of(3), clock);
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");

        // When: touch a and c, leaving b least recently used
        cache.get("a");
        cache.get("c");
        cache.set("d", "4");

        // Then
        assertFalse(cache.has("b"), "b should be evicted");
        assertTrue(cache.has("a"));
        assertTrue(cache.has("c"));
        assertTrue(cache.has("d"));
        assertEquals(3, cache.size());
    }

    @Test
    void testLru_HasDoesNotRefreshOrder() {
        // Given
        Cache<String, String> cache = createCache(CacheConfig.of(2), clock);
        cache.set("a", "1");
        cache.set("b", "2");

        // When
        cache.has("a");
        cache.set("c", "3");

        // Then
        assertFalse(cache.has("a"), "has() must not protect a from eviction");
        assertEquals(List.of("b", "c"), cache.keys());
    }

    @Test
    void testSet_OverwriteDoesNotEvict() {
        Cache<String, String> cache = createCache(CacheConfig.of(2), clock);
        cache.set("a", "1");
        cache.set("b", "2");

        cache.set("a", "updated");

        assertEquals(2, cache.size());
        assertEquals(Optional.of("updated"), cache.get("a"));
        assertEquals(Optional.of("2"), cache.get("b"));
    }

    @Test
    void testSet_RejectsNullValue() {
        Cache<String, String> cache = createCache(CacheConfig.of(2), clock);

        assertThrows(IllegalArgumentException.class, () -> cache.set("a", null));
    }

    @Test
    void testDeleteAndClear() {
        Cache<String, String> cache = createCache(CacheConfig.of(10), clock);
        cache.set("a", "1");
        cache.set("b", "2");

        assertTrue(cache.delete("a"));
        assertFalse(cache.delete("a"));
        assertEquals(List.of("2"), cache.values());

        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void testGetOrSetSync_FactoryCalledOnce() {
        // Given
        Cache<String, String> cache = createCache(CacheConfig.of(10), clock);
        AtomicInteger calls = new AtomicInteger();

        // When
        String first = cache.getOrSetSync("k", () -> "v" + calls.incrementAndGet());
        String second = cache.getOrSetSync("k", () -> "v" + calls.incrementAndGet());

        // Then
        assertEquals("v1", first);
        assertEquals("v1", second);
        assertEquals(1, calls.get());
    }

    @Test
    void testGetOrSet_SequentialCallsInvokeFactoryOnce() throws Exception {
        // Given
        Cache<String, String> cache = createCache(CacheConfig.of(10), clock);
        AtomicInteger calls = new AtomicInteger();

        // When
        String first = cache.getOrSet("k",
            () -> CompletableFuture.completedFuture("v" + calls.incrementAndGet())).get();
        String second = cache.getOrSet("k",
            () -> CompletableFuture.completedFuture("v" + calls.incrementAndGet())).get();

        // Then
        assertEquals("v1", first);
        assertEquals("v1", second);
        assertEquals(1, calls.get());
    }

    @Test
    void testGetOrSet_PendingCallsShareOneComputation() throws Exception {
        // Given
        Cache<String, String> cache = createCache(CacheConfig.of(10), clock);
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<String> remote = new CompletableFuture<>();

        // When
        CompletableFuture<String> first = cache.getOrSet("k", () -> {
            calls.incrementAndGet();
            return remote;
        });
        CompletableFuture<String> second = cache.getOrSet("k", () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("other");
        });
        remote.complete("v");

        // Then
        assertEquals("v", first.get());
        assertEquals("v", second.get());
        assertEquals(1, calls.get());
        assertEquals(Optional.of("v"), cache.get("k"));
    }

    @Test
    void testGetOrSet_FailureNotCached() throws Exception {
        // Given
        Cache<String, String> cache = createCache(CacheConfig.of(10), clock);
        IllegalStateException boom = new IllegalStateException("boom");

        // When
        CompletableFuture<String> failed = cache.getOrSet("k", () -> CompletableFuture.failedFuture(boom));

        // Then
        ExecutionException e = assertThrows(ExecutionException.class, failed::get);
        assertSame(boom, e.getCause());
        assertFalse(cache.has("k"));
        assertEquals("v", cache.getOrSet("k", () -> CompletableFuture.completedFuture("v")).get());
    }
}

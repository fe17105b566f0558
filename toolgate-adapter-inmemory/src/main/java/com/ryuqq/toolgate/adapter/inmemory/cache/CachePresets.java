package com.ryuqq.toolgate.adapter.inmemory.cache;

import com.ryuqq.toolgate.core.clock.Clock;
import com.ryuqq.toolgate.core.spi.CacheConfig;

/**
 * Factory methods for the caches used by the tool handlers.
 *
 * <p>Each call returns a fresh instance; wire one per call path rather than sharing a global.</p>
 *
 * <ul>
 *   <li>model: 500 entries, 1 hour (model metadata rarely changes)</li>
 *   <li>image: 100 entries, 15 minutes (uploaded images and intermediate results)</li>
 *   <li>response: 50 entries, 30 seconds (deduplicating identical requests)</li>
 * </ul>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class CachePresets {

    public static final CacheConfig MODEL = CacheConfig.of(500, 60 * 60 * 1000L);
    public static final CacheConfig IMAGE = CacheConfig.of(100, 15 * 60 * 1000L);
    public static final CacheConfig RESPONSE = CacheConfig.of(50, 30 * 1000L);

    private CachePresets() {
    }

    public static <V> BoundedCache<String, V> modelCache(Clock clock) {
        return new BoundedCache<>(MODEL, clock);
    }

    public static <V> BoundedCache<String, V> imageCache(Clock clock) {
        return new BoundedCache<>(IMAGE, clock);
    }

    public static <V> BoundedCache<String, V> responseCache(Clock clock) {
        return new BoundedCache<>(RESPONSE, clock);
    }
}

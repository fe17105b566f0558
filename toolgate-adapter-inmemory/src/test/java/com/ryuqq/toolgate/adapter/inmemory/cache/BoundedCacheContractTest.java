package com.ryuqq.toolgate.adapter.inmemory.cache;

import com.ryuqq.toolgate.core.clock.Clock;
import com.ryuqq.toolgate.core.spi.Cache;
import com.ryuqq.toolgate.core.spi.CacheConfig;
import com.ryuqq.toolgate.testkit.contract.AbstractCacheContractTest;

/**
 * Runs the cache contract against {@link BoundedCache}.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
class BoundedCacheContractTest extends AbstractCacheContractTest {

    @Override
    protected Cache<String, String> createCache(CacheConfig config, Clock clock) {
        return new BoundedCache<>(config, clock);
    }
}

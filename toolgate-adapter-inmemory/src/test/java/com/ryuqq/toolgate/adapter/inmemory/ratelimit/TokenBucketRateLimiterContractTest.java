package com.ryuqq.toolgate.adapter.inmemory.ratelimit;

import com.ryuqq.toolgate.core.protection.RateLimiter;
import com.ryuqq.toolgate.core.protection.RateLimiterConfig;
import com.ryuqq.toolgate.testkit.contract.AbstractRateLimiterContractTest;
import com.ryuqq.toolgate.testkit.time.ManualClock;
import com.ryuqq.toolgate.testkit.time.ManualScheduler;

/**
 * Runs the rate limiter contract against {@link TokenBucketRateLimiter}.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
class TokenBucketRateLimiterContractTest extends AbstractRateLimiterContractTest {

    @Override
    protected RateLimiter createRateLimiter(RateLimiterConfig config, ManualClock clock, ManualScheduler scheduler) {
        return new TokenBucketRateLimiter(config, clock, scheduler);
    }
}

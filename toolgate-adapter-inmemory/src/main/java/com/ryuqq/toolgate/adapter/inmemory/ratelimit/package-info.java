/**
 * In-memory token bucket rate limiter.
 *
 * <p>{@link com.ryuqq.toolgate.adapter.inmemory.ratelimit.TokenBucketRateLimiter} needs a
 * {@link com.ryuqq.toolgate.core.spi.Scheduler} to wake queued waiters; production wiring uses
 * the executor-backed scheduler from the runner module, tests use a manual one from the testkit.</p>
 *
 * @see com.ryuqq.toolgate.core.protection.RateLimiter
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.adapter.inmemory.ratelimit;

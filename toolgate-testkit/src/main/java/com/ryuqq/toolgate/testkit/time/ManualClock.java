package com.ryuqq.toolgate.testkit.time;

import com.ryuqq.toolgate.core.clock.Clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Clock} that only moves when a test moves it.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ManualClock clock = new ManualClock();
 * BoundedCache&lt;String, String&gt; cache = new BoundedCache&lt;&gt;(CacheConfig.of(10, 1000), clock);
 *
 * cache.set("k", "v");
 * clock.advanceMillis(1000);
 * assertTrue(cache.get("k").isEmpty());
 * </pre>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class ManualClock implements Clock {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final AtomicLong nanos;

    /**
     * Creates a clock starting at zero.
     */
    public ManualClock() {
        this(0L);
    }

    /**
     * Creates a clock starting at the given reading.
     *
     * @param startNanos initial reading
     */
    public ManualClock(long startNanos) {
        this.nanos = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return nanos.get();
    }

    /**
     * Moves the clock forward.
     *
     * @param millis milliseconds to advance (non-negative)
     * @throws IllegalArgumentException if millis is negative
     */
    public void advanceMillis(long millis) {
        advanceNanos(millis * NANOS_PER_MILLI);
    }

    /**
     * Moves the clock forward.
     *
     * @param delta nanoseconds to advance (non-negative)
     * @throws IllegalArgumentException if delta is negative
     */
    public void advanceNanos(long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("delta must not be negative (current: " + delta + ")");
        }
        nanos.addAndGet(delta);
    }

    /**
     * Current reading in whole milliseconds.
     *
     * @return elapsed milliseconds since zero
     */
    public long nowMillis() {
        return nanos.get() / NANOS_PER_MILLI;
    }

    void moveTo(long targetNanos) {
        nanos.accumulateAndGet(targetNanos, Math::max);
    }
}

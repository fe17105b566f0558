package com.ryuqq.toolgate.adapter.inmemory.ratelimit;

import com.ryuqq.toolgate.core.cancel.CancellationRegistration;
import com.ryuqq.toolgate.core.cancel.CancellationToken;
import com.ryuqq.toolgate.core.clock.Clock;
import com.ryuqq.toolgate.core.clock.SystemClock;
import com.ryuqq.toolgate.core.error.OperationCancelledException;
import com.ryuqq.toolgate.core.error.RateLimitExceededException;
import com.ryuqq.toolgate.core.protection.RateLimiter;
import com.ryuqq.toolgate.core.protection.RateLimiterConfig;
import com.ryuqq.toolgate.core.spi.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory token bucket implementation of {@link RateLimiter}.
 *
 * <p>Allows bursts up to {@code maxTokens}, then throttles to {@code refillRate} tokens per second.
 * Single-process only; the bucket lives in this instance.</p>
 *
 * <p><strong>Token Accounting:</strong></p>
 * <ul>
 *   <li>Tokens are derived from the total elapsed time since a fixed origin:
 *       {@code tokensAtOrigin + elapsed * refillRate - consumedSinceOrigin}</li>
 *   <li>The origin moves only when the bucket saturates or is reset, so refill never accumulates
 *       small floating-point deltas</li>
 *   <li>Tokens are fractional internally; {@link #getAvailableTokens()} floors for reporting</li>
 * </ul>
 *
 * <p><strong>Waiters:</strong></p>
 * <ul>
 *   <li>{@link #waitForToken(CancellationToken)} callers join a FIFO queue</li>
 *   <li>One drain timer, scheduled for {@link #getTimeUntilNextToken()}, grants each freed token
 *       to exactly one waiter in arrival order</li>
 *   <li>{@link #acquire()} does not barge ahead of queued waiters</li>
 *   <li>A cancelled waiter leaves the queue without consuming a token; the drain timer is
 *       cancelled once the queue is empty</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> all bucket and queue state is guarded by one monitor.
 * Waiter futures are completed outside the monitor.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final RateLimiterConfig config;
    private final Clock clock;
    private final Scheduler scheduler;

    private final Object lock = new Object();
    private final ArrayDeque<Waiter> waiters = new ArrayDeque<>();

    // guarded by lock
    private long originNanos;
    private double tokensAtOrigin;
    private long consumedSinceOrigin;
    private Scheduler.ScheduledTask drainTask;

    /**
     * Creates a limiter on the system clock.
     *
     * @param config bucket configuration
     * @param scheduler timer used to wake queued waiters
     */
    public TokenBucketRateLimiter(RateLimiterConfig config, Scheduler scheduler) {
        this(config, SystemClock.instance(), scheduler);
    }

    /**
     * Creates a limiter with an explicit clock.
     *
     * @param config bucket configuration
     * @param clock monotonic clock
     * @param scheduler timer used to wake queued waiters
     * @throws IllegalArgumentException if any argument is null
     */
    public TokenBucketRateLimiter(RateLimiterConfig config, Clock clock, Scheduler scheduler) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
        this.originNanos = clock.nowNanos();
        this.tokensAtOrigin = config.maxTokens();
        this.consumedSinceOrigin = 0;
    }

    @Override
    public boolean acquire() {
        synchronized (lock) {
            if (!waiters.isEmpty()) {
                return false;
            }
            return tryConsume(clock.nowNanos());
        }
    }

    @Override
    public void acquireOrThrow() {
        long retryAfterMs;
        synchronized (lock) {
            long now = clock.nowNanos();
            if (waiters.isEmpty() && tryConsume(now)) {
                return;
            }
            retryAfterMs = timeUntilNextToken(now);
        }
        throw new RateLimitExceededException(
            "Rate limit exceeded. Please wait before making more requests.", retryAfterMs);
    }

    @Override
    public CompletableFuture<Void> waitForToken(CancellationToken cancellationToken) {
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
        if (cancellationToken.isCancellationRequested()) {
            return CompletableFuture.failedFuture(cancelled());
        }

        Waiter waiter = new Waiter();
        synchronized (lock) {
            if (waiters.isEmpty() && tryConsume(clock.nowNanos())) {
                return CompletableFuture.completedFuture(null);
            }
            waiters.addLast(waiter);
            try {
                scheduleDrainIfNeeded(clock.nowNanos());
            } catch (RuntimeException e) {
                waiters.remove(waiter);
                return CompletableFuture.failedFuture(e);
            }
            log.debug("Queued rate-limit waiter, {} waiting", waiters.size());
        }

        waiter.attach(cancellationToken.onCancel(() -> cancelWaiter(waiter)));
        return waiter.future;
    }

    @Override
    public int getAvailableTokens() {
        synchronized (lock) {
            return (int) Math.floor(currentTokens(clock.nowNanos()));
        }
    }

    @Override
    public long getTimeUntilNextToken() {
        synchronized (lock) {
            return timeUntilNextToken(clock.nowNanos());
        }
    }

    @Override
    public void reset() {
        boolean hasWaiters;
        synchronized (lock) {
            rebase(clock.nowNanos(), config.maxTokens());
            cancelDrainTask();
            hasWaiters = !waiters.isEmpty();
        }
        if (hasWaiters) {
            drain();
        }
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    /**
     * Number of callers currently queued in {@link #waitForToken(CancellationToken)}.
     *
     * @return queued waiter count
     */
    public int getQueuedWaiterCount() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    /**
     * Grants tokens to waiters from the head of the queue and re-arms the drain timer.
     *
     * <p>A token granted to a waiter that completed concurrently is refunded and offered to
     * the next waiter right away. If the timer cannot be re-armed, every remaining waiter
     * fails with the scheduling error.</p>
     */
    private void drain() {
        List<Waiter> granted = new ArrayList<>();
        List<Waiter> stranded = new ArrayList<>();
        RuntimeException scheduleFailure = null;
        synchronized (lock) {
            cancelDrainTask();
            long now = clock.nowNanos();
            while (!waiters.isEmpty()) {
                Waiter head = waiters.peekFirst();
                if (head.future.isDone()) {
                    waiters.pollFirst();
                    continue;
                }
                if (!tryConsume(now)) {
                    break;
                }
                waiters.pollFirst();
                granted.add(head);
            }
            try {
                scheduleDrainIfNeeded(now);
            } catch (RuntimeException e) {
                scheduleFailure = e;
                stranded.addAll(waiters);
                waiters.clear();
            }
            if (!granted.isEmpty()) {
                log.debug("Granted {} rate-limit waiters, {} still waiting", granted.size(), waiters.size());
            }
        }

        boolean refunded = false;
        for (Waiter waiter : granted) {
            waiter.detach();
            if (!waiter.future.complete(null)) {
                refund();
                refunded = true;
            }
        }
        if (scheduleFailure != null) {
            log.warn("Could not schedule rate-limit drain, failing {} waiters", stranded.size(), scheduleFailure);
            for (Waiter waiter : stranded) {
                waiter.detach();
                waiter.future.completeExceptionally(scheduleFailure);
            }
        } else if (refunded) {
            drain();
        }
    }

    private void cancelWaiter(Waiter waiter) {
        boolean removed;
        synchronized (lock) {
            removed = waiters.remove(waiter);
            if (waiters.isEmpty()) {
                cancelDrainTask();
            }
        }
        if (removed) {
            waiter.future.completeExceptionally(cancelled());
        }
    }

    private void refund() {
        synchronized (lock) {
            consumedSinceOrigin--;
        }
    }

    // guarded by lock
    private void scheduleDrainIfNeeded(long now) {
        if (waiters.isEmpty() || drainTask != null) {
            return;
        }
        drainTask = scheduler.schedule(this::drain, timeUntilNextToken(now));
    }

    // guarded by lock
    private void cancelDrainTask() {
        if (drainTask != null) {
            drainTask.cancel();
            drainTask = null;
        }
    }

    // guarded by lock
    private boolean tryConsume(long now) {
        if (currentTokens(now) >= 1) {
            consumedSinceOrigin++;
            return true;
        }
        return false;
    }

    // guarded by lock
    private long timeUntilNextToken(long now) {
        double tokens = currentTokens(now);
        if (tokens >= 1) {
            return 0;
        }
        double tokensNeeded = 1 - tokens;
        return (long) Math.ceil(tokensNeeded / config.refillRate() * 1000);
    }

    // guarded by lock
    private double currentTokens(long now) {
        long elapsedNanos = Math.max(0L, now - originNanos);
        double tokens = tokensAtOrigin
            + elapsedNanos * config.refillRate() / NANOS_PER_SECOND
            - consumedSinceOrigin;
        if (tokens >= config.maxTokens()) {
            rebase(now, config.maxTokens());
            return config.maxTokens();
        }
        return Math.max(0d, tokens);
    }

    // guarded by lock
    private void rebase(long now, double tokens) {
        originNanos = now;
        tokensAtOrigin = tokens;
        consumedSinceOrigin = 0;
    }

    private static OperationCancelledException cancelled() {
        return new OperationCancelledException("Rate limit wait was cancelled");
    }

    /**
     * Queued {@code waitForToken} caller.
     */
    private static final class Waiter {

        private final CompletableFuture<Void> future = new CompletableFuture<>();
        private volatile CancellationRegistration registration;

        void attach(CancellationRegistration registration) {
            this.registration = registration;
            if (future.isDone()) {
                registration.unregister();
            }
        }

        void detach() {
            CancellationRegistration current = registration;
            if (current != null) {
                current.unregister();
            }
        }
    }
}

package com.ryuqq.toolgate.adapter.runner;

import com.ryuqq.toolgate.core.cancel.CancellationToken;
import com.ryuqq.toolgate.core.error.RateLimitExceededException;
import com.ryuqq.toolgate.core.protection.RateLimiter;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 비동기 호출에 Rate Limit을 씌우는 래퍼.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class RateLimitedCalls {

    private RateLimitedCalls() {
    }

    /**
     * 토큰이 없으면 호출하지 않고 {@link RateLimitExceededException}으로 실패하는 호출.
     *
     * @param call 원본 호출
     * @param limiter Rate Limiter
     * @param <T> 결과 타입
     * @return 래핑된 호출
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <T> Supplier<CompletableFuture<T>> withRateLimit(
        Supplier<CompletableFuture<T>> call,
        RateLimiter limiter
    ) {
        requireNonNull(call, limiter);
        return () -> {
            try {
                limiter.acquireOrThrow();
            } catch (RateLimitExceededException e) {
                return CompletableFuture.failedFuture(e);
            }
            return call.get();
        };
    }

    /**
     * 토큰을 얻을 때까지 기다린 뒤 호출.
     *
     * @param call 원본 호출
     * @param limiter Rate Limiter
     * @param cancellationToken 대기 취소 토큰
     * @param <T> 결과 타입
     * @return 래핑된 호출
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <T> Supplier<CompletableFuture<T>> withRateLimitWait(
        Supplier<CompletableFuture<T>> call,
        RateLimiter limiter,
        CancellationToken cancellationToken
    ) {
        requireNonNull(call, limiter);
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
        return () -> limiter.waitForToken(cancellationToken).thenCompose(ignored -> call.get());
    }

    private static void requireNonNull(Supplier<?> call, RateLimiter limiter) {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
    }
}

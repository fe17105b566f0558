package com.ryuqq.toolgate.core.retry;

import com.ryuqq.toolgate.core.cancel.CancellationToken;

import java.util.function.Predicate;

/**
 * 재시도 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수 (기본 3)</li>
 *   <li>initialDelayMs: 첫 재시도 전 대기 (기본 1000ms)</li>
 *   <li>maxDelayMs: 대기 상한 (기본 30000ms)</li>
 *   <li>backoffMultiplier: 대기 증가 배수 (기본 2.0)</li>
 *   <li>retryCondition: 재시도 가능 오류 판별 (기본 모든 오류)</li>
 *   <li>cancellationToken: 취소 토큰 (기본 취소 없음)</li>
 *   <li>listener: 재시도 관찰 훅 (기본 없음)</li>
 * </ul>
 *
 * <p><strong>예시 (initialDelayMs=1000, backoffMultiplier=10, maxDelayMs=5000, maxAttempts=4):</strong>
 * 대기 순서는 1000, 5000, 5000ms 입니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param initialDelayMs 첫 재시도 대기 (밀리초, 0 이상)
 * @param maxDelayMs 대기 상한 (밀리초, initialDelayMs 이상)
 * @param backoffMultiplier 대기 증가 배수 (1.0 이상)
 * @param retryCondition 재시도 가능 오류 판별
 * @param cancellationToken 취소 토큰
 * @param listener 재시도 관찰 훅
 */
public record RetryPolicy(
    int maxAttempts,
    long initialDelayMs,
    long maxDelayMs,
    double backoffMultiplier,
    Predicate<Throwable> retryCondition,
    CancellationToken cancellationToken,
    RetryListener listener
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, initialDelayMs=1000ms, maxDelayMs=30000ms, backoffMultiplier=2.0,
     * 모든 오류 재시도, 취소 없음, 리스너 없음</p>
     */
    public RetryPolicy() {
        this(3, 1000, 30000, 2.0, error -> true, CancellationToken.none(), RetryListener.NONE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be at least 1 (current: " + maxAttempts + ")"
            );
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs must not be negative (current: " + initialDelayMs + ")"
            );
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= initialDelayMs (initial: " + initialDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (!(backoffMultiplier >= 1.0) || Double.isInfinite(backoffMultiplier)) {
            throw new IllegalArgumentException(
                "backoffMultiplier must be >= 1.0 (current: " + backoffMultiplier + ")"
            );
        }
        if (retryCondition == null) {
            throw new IllegalArgumentException("retryCondition cannot be null");
        }
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
    }

    /**
     * 오류가 재시도 가능한지 판별.
     *
     * @param error 실패 원인
     * @return 재시도 가능하면 true
     */
    public boolean isRetryable(Throwable error) {
        return retryCondition.test(error);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxDelayMs, backoffMultiplier, retryCondition, cancellationToken, listener);
    }

    /**
     * initialDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withInitialDelayMs(long initialDelayMs) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxDelayMs, backoffMultiplier, retryCondition, cancellationToken, listener);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxDelayMs, backoffMultiplier, retryCondition, cancellationToken, listener);
    }

    /**
     * backoffMultiplier만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBackoffMultiplier(double backoffMultiplier) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxDelayMs, backoffMultiplier, retryCondition, cancellationToken, listener);
    }

    /**
     * retryCondition만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withRetryCondition(Predicate<Throwable> retryCondition) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxDelayMs, backoffMultiplier, retryCondition, cancellationToken, listener);
    }

    /**
     * cancellationToken만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withCancellationToken(CancellationToken cancellationToken) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxDelayMs, backoffMultiplier, retryCondition, cancellationToken, listener);
    }

    /**
     * listener만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withListener(RetryListener listener) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxDelayMs, backoffMultiplier, retryCondition, cancellationToken, listener);
    }
}

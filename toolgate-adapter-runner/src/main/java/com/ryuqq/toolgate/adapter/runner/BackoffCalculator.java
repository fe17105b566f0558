package com.ryuqq.toolgate.adapter.runner;

import com.ryuqq.toolgate.core.retry.RetryPolicy;

/**
 * Exponential Backoff 계산기.
 *
 * <p>재시도 간격을 배수만큼 늘리되 상한에서 멈춥니다. 대기 순서는 단조 증가(non-decreasing)합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay(1) = initialDelay
 * delay(n) = min(delay(n-1) * multiplier, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=1000ms, multiplier=2, maxDelay=30000ms):</strong></p>
 * <ul>
 *   <li>retryNumber=1: 1000ms</li>
 *   <li>retryNumber=2: 2000ms</li>
 *   <li>retryNumber=3: 4000ms</li>
 *   <li>retryNumber=6: 30000ms (32000ms에서 상한 적용)</li>
 * </ul>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double multiplier;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: initialDelay=1000ms, maxDelay=30000ms, multiplier=2.0</p>
     */
    public BackoffCalculator() {
        this(1000, 30000, 2.0);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param initialDelayMs 첫 재시도 대기 (밀리초, 0 이상)
     * @param maxDelayMs 최대 대기 (밀리초, initialDelayMs 이상)
     * @param multiplier 증가 배수 (1.0 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long initialDelayMs, long maxDelayMs, double multiplier) {
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
        if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }

        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
    }

    /**
     * 재시도 정책의 대기 설정으로 생성.
     *
     * @param policy 재시도 정책
     * @return BackoffCalculator
     */
    public static BackoffCalculator from(RetryPolicy policy) {
        return new BackoffCalculator(policy.initialDelayMs(), policy.maxDelayMs(), policy.backoffMultiplier());
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param retryNumber 재시도 순번 (1부터 시작, 첫 실패 직후가 1)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryNumber가 양수가 아닌 경우
     */
    public long calculate(int retryNumber) {
        if (retryNumber <= 0) {
            throw new IllegalArgumentException(
                "retryNumber must be positive (current: " + retryNumber + ")"
            );
        }

        double delay = initialDelayMs;
        for (int i = 1; i < retryNumber && delay < maxDelayMs; i++) {
            delay = Math.min(delay * multiplier, maxDelayMs);
        }
        return Math.round(delay);
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getMultiplier() {
        return multiplier;
    }
}

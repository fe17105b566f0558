package com.ryuqq.toolgate.core.retry;

/**
 * 재시도 관찰 훅.
 *
 * <p>재시도가 예약될 때마다, sleep 직전에 호출됩니다.
 * 마지막 시도의 실패나 재시도 불가 오류에 대해서는 호출되지 않습니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * 아무 것도 하지 않는 리스너.
     */
    RetryListener NONE = (error, attempt, delayMs) -> { };

    /**
     * 재시도 예약 알림.
     *
     * @param error 방금 실패한 시도의 원본 오류
     * @param attempt 방금 실패한 시도 번호 (1부터 시작)
     * @param delayMs 다음 시도까지 대기 시간 (밀리초)
     */
    void onRetry(Throwable error, int attempt, long delayMs);
}

package com.ryuqq.toolgate.core.protection;

import com.ryuqq.toolgate.core.cancel.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limiter SPI.
 *
 * <p>외부 API처럼 호출 빈도가 제한된 공유 자원에 대한 발신 호출 속도를 제한합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = ...;
 *
 * // 1. 비블로킹 확인
 * if (!limiter.acquire()) {
 *     return;
 * }
 *
 * // 2. 토큰이 생길 때까지 대기 (취소 가능)
 * limiter.waitForToken(token)
 *     .thenCompose(ignored -> remoteApi.call());
 * }</pre>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 토큰 획득 시도 (비블로킹).
     *
     * <p>경과 시간만큼 토큰을 보충한 뒤, 1개 이상 남아 있으면 1개를 소비합니다.</p>
     *
     * @return true: 토큰 획득, false: 토큰 없음
     */
    boolean acquire();

    /**
     * 토큰 획득 시도, 실패 시 예외.
     *
     * @throws com.ryuqq.toolgate.core.error.RateLimitExceededException 토큰이 없는 경우 (retryAfterMs 포함)
     */
    void acquireOrThrow();

    /**
     * 토큰을 얻을 때까지 비동기 대기.
     *
     * <p>반환된 future는 토큰을 획득하면 완료됩니다.
     * 취소 토큰이 먼저 발화하면 {@link com.ryuqq.toolgate.core.error.OperationCancelledException}으로
     * 실패하며, 이 경우 토큰은 소비되지 않습니다.</p>
     *
     * @param cancellationToken 취소 토큰
     * @return 토큰 획득 시 완료되는 future
     */
    CompletableFuture<Void> waitForToken(CancellationToken cancellationToken);

    /**
     * 취소 없이 토큰 대기.
     *
     * @return 토큰 획득 시 완료되는 future
     */
    default CompletableFuture<Void> waitForToken() {
        return waitForToken(CancellationToken.none());
    }

    /**
     * 현재 사용 가능한 토큰 수 (내림).
     *
     * @return 정수 토큰 수
     */
    int getAvailableTokens();

    /**
     * 다음 토큰까지 남은 시간.
     *
     * @return 밀리초 (토큰이 있으면 0)
     */
    long getTimeUntilNextToken();

    /**
     * 버킷을 최대 용량으로 복원 (테스트 및 장애 복구용).
     */
    void reset();

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return Rate Limiter 설정
     */
    RateLimiterConfig getConfig();
}

package com.ryuqq.toolgate.core.error;

/**
 * 사용 가능한 토큰이 없어 요청이 거부됨.
 *
 * <p>{@code retryAfterMs}는 다음 토큰이 보충될 때까지의 예상 시간입니다:
 * {@code ceil((1 - tokens) / refillRate * 1000)}.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public class RateLimitExceededException extends ToolGateException {

    private final long retryAfterMs;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param retryAfterMs 재시도까지 대기 시간 (밀리초, 음수는 0으로 보정)
     */
    public RateLimitExceededException(String message, long retryAfterMs) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED, message);
        this.retryAfterMs = Math.max(0L, retryAfterMs);
    }

    /**
     * 재시도까지 대기 시간 조회.
     *
     * @return 밀리초
     */
    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}

package com.ryuqq.toolgate.core.protection;

/**
 * Rate Limiter 설정.
 *
 * <p>Token Bucket 알고리즘의 동작을 제어하는 설정 정보입니다.</p>
 *
 * @param maxTokens 버킷 최대 토큰 수 (버스트 허용량, 양수)
 * @param refillRate 초당 보충 토큰 수 (지속 처리율, 양수)
 * @author ToolGate Team
 * @since 1.0.0
 */
public record RateLimiterConfig(int maxTokens, double refillRate) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxTokens=10, refillRate=1.0</p>
     */
    public RateLimiterConfig() {
        this(10, 1.0);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxTokens is not positive
     * @throws IllegalArgumentException if refillRate is not positive
     */
    public RateLimiterConfig {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException(
                "maxTokens must be positive (current: " + maxTokens + ")"
            );
        }
        if (!(refillRate > 0) || Double.isInfinite(refillRate)) {
            throw new IllegalArgumentException(
                "refillRate must be positive (current: " + refillRate + ")"
            );
        }
    }
}

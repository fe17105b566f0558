package com.ryuqq.toolgate.core.clock;

/**
 * 단조(monotonic) 시계 추상화.
 *
 * <p>Rate Limiter의 토큰 보충 계산과 Cache의 TTL 판정에 사용됩니다.
 * 테스트에서는 수동으로 시간을 진행시키는 구현으로 교체합니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Clock {

    /**
     * 현재 단조 시각 (나노초).
     *
     * <p>절대값에는 의미가 없으며, 두 시각의 차이만 경과 시간으로 사용합니다.</p>
     *
     * @return 단조 시각 (나노초)
     */
    long nowNanos();
}

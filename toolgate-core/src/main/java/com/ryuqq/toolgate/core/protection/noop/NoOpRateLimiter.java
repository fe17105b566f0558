package com.ryuqq.toolgate.core.protection.noop;

import com.ryuqq.toolgate.core.cancel.CancellationToken;
import com.ryuqq.toolgate.core.error.OperationCancelledException;
import com.ryuqq.toolgate.core.protection.RateLimiter;
import com.ryuqq.toolgate.core.protection.RateLimiterConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 항상 허용합니다.
 * 개발 및 테스트 환경에서 사용하거나, Rate Limiting 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>acquire(): 항상 true 반환</li>
 *   <li>waitForToken(): 즉시 완료 (이미 취소된 토큰만 실패)</li>
 *   <li>getConfig(): 무제한 설정 반환</li>
 * </ul>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED_CONFIG =
        new RateLimiterConfig(Integer.MAX_VALUE, Double.MAX_VALUE);

    @Override
    public boolean acquire() {
        return true;
    }

    @Override
    public void acquireOrThrow() {
    }

    @Override
    public CompletableFuture<Void> waitForToken(CancellationToken cancellationToken) {
        if (cancellationToken.isCancellationRequested()) {
            return CompletableFuture.failedFuture(
                new OperationCancelledException("Rate limit wait was cancelled"));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public int getAvailableTokens() {
        return Integer.MAX_VALUE;
    }

    @Override
    public long getTimeUntilNextToken() {
        return 0;
    }

    @Override
    public void reset() {
    }

    @Override
    public RateLimiterConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}

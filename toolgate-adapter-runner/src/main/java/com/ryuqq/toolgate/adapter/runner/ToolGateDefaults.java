package com.ryuqq.toolgate.adapter.runner;

import com.ryuqq.toolgate.adapter.inmemory.ratelimit.TokenBucketRateLimiter;
import com.ryuqq.toolgate.adapter.inmemory.registry.InMemoryOperationRegistry;
import com.ryuqq.toolgate.application.config.ToolGateProperties;
import com.ryuqq.toolgate.application.dispatcher.ToolDispatcher;
import com.ryuqq.toolgate.core.protection.RateLimiter;
import com.ryuqq.toolgate.core.spi.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 프로세스 단위 기본 인스턴스 모음.
 *
 * <p>ToolGate에서 유일한 싱글톤 보관소입니다. 모든 컴포넌트는 명시적 설정으로 직접 생성할 수 있으며,
 * 이 클래스는 최상위 진입점의 편의를 위한 것입니다.</p>
 *
 * <p>각 인스턴스는 처음 접근할 때 프로세스 환경 변수({@link ToolGateProperties#fromSystemEnvironment()})로
 * 생성됩니다. 설정이 잘못되면 첫 접근에서 {@link IllegalArgumentException}이 발생합니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class ToolGateDefaults {

    private static final Logger log = LoggerFactory.getLogger(ToolGateDefaults.class);

    private ToolGateDefaults() {
    }

    /**
     * 기본 Rate Limiter.
     *
     * @return 공유 TokenBucketRateLimiter
     */
    public static RateLimiter rateLimiter() {
        return Holder.RATE_LIMITER;
    }

    /**
     * 기본 Operation 레지스트리.
     *
     * @return 공유 InMemoryOperationRegistry
     */
    public static OperationRegistry operationRegistry() {
        return Holder.REGISTRY;
    }

    /**
     * 기본 재시도 실행기.
     *
     * @return 공유 RetryExecutor
     */
    public static RetryExecutor retryExecutor() {
        return Holder.RETRY_EXECUTOR;
    }

    /**
     * 기본 디스패처.
     *
     * @return 공유 GuardedToolDispatcher
     */
    public static ToolDispatcher dispatcher() {
        return Holder.DISPATCHER;
    }

    private static final class Holder {

        private static final ToolGateProperties PROPERTIES = ToolGateProperties.fromSystemEnvironment();
        private static final ExecutorScheduler SCHEDULER = ExecutorScheduler.create("toolgate-timer");
        private static final RateLimiter RATE_LIMITER =
            new TokenBucketRateLimiter(PROPERTIES.toRateLimiterConfig(), SCHEDULER);
        private static final OperationRegistry REGISTRY = new InMemoryOperationRegistry();
        private static final RetryExecutor RETRY_EXECUTOR = new RetryExecutor(SCHEDULER);
        private static final ToolDispatcher DISPATCHER =
            new GuardedToolDispatcher(REGISTRY, RATE_LIMITER, RETRY_EXECUTOR, PROPERTIES.toRetryPolicy());

        static {
            log.info("ToolGate defaults initialized: rateLimit={} tokens @ {}/s, retry={} attempts ({}ms..{}ms)",
                PROPERTIES.rateLimitMaxTokens(), PROPERTIES.rateLimitRefillRate(),
                PROPERTIES.retryMaxAttempts(), PROPERTIES.retryInitialDelayMs(), PROPERTIES.retryMaxDelayMs());
        }
    }
}

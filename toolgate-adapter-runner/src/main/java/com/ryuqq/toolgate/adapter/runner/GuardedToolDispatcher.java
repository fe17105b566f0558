package com.ryuqq.toolgate.adapter.runner;

import com.ryuqq.toolgate.application.dispatcher.ToolDispatcher;
import com.ryuqq.toolgate.core.cancel.CancellationToken;
import com.ryuqq.toolgate.core.contract.ToolCall;
import com.ryuqq.toolgate.core.contract.ToolContext;
import com.ryuqq.toolgate.core.error.Failures;
import com.ryuqq.toolgate.core.model.OpId;
import com.ryuqq.toolgate.core.progress.ProgressReporter;
import com.ryuqq.toolgate.core.progress.ProgressSink;
import com.ryuqq.toolgate.core.progress.ProgressSinks;
import com.ryuqq.toolgate.core.protection.RateLimiter;
import com.ryuqq.toolgate.core.retry.RetryPolicy;
import com.ryuqq.toolgate.core.spi.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limit + 재시도 + 취소 보호를 적용하는 {@link ToolDispatcher} 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>OperationRegistry에 취소 가능한 Operation 등록</li>
 *   <li>best-effort 진행률 보고자와 ToolContext 생성</li>
 *   <li>RetryExecutor 실행: 정책의 취소 토큰을 Operation 토큰으로 교체</li>
 *   <li>매 시도마다 Rate Limit 토큰 대기 후 원격 호출 (재시도도 토큰을 소비)</li>
 *   <li>성공, 실패, 취소, 동기 예외 모든 경로에서 Operation 완료 처리</li>
 * </ol>
 *
 * <p>반환된 future가 완료되는 시점에는 Operation이 이미 레지스트리에서 제거되어 있습니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 자체 상태가 없으며, 협력 객체들이 thread-safe하면 이 클래스도 thread-safe합니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class GuardedToolDispatcher implements ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(GuardedToolDispatcher.class);

    private final OperationRegistry registry;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    /**
     * 생성자.
     *
     * @param registry Operation 레지스트리
     * @param rateLimiter 모든 시도가 공유하는 Rate Limiter
     * @param retryExecutor 재시도 실행기
     * @param retryPolicy 기본 재시도 정책 (취소 토큰은 호출마다 교체됨)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public GuardedToolDispatcher(
        OperationRegistry registry,
        RateLimiter rateLimiter,
        RetryExecutor retryExecutor,
        RetryPolicy retryPolicy
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (retryExecutor == null) {
            throw new IllegalArgumentException("retryExecutor cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        this.registry = registry;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public <T> CompletableFuture<T> dispatch(OpId opId, ToolCall<T> call, ProgressSink sink) {
        validateInput(opId, call, sink);

        // 1. Operation 등록
        CancellationToken token = registry.createCancellableOperation(opId);
        CompletableFuture<T> outcome = new CompletableFuture<>();
        try {
            // 2. 진행률 보고자 + 컨텍스트
            ProgressReporter progress = registry.createProgressReporter(opId, ProgressSinks.bestEffort(sink));
            ToolContext context = new ToolContext(opId, token, progress);

            // 3. 시도마다 Rate Limit 대기 후 호출
            RetryPolicy policy = retryPolicy.withCancellationToken(token);
            CompletableFuture<T> result = retryExecutor.execute(
                RateLimitedCalls.withRateLimitWait(() -> call.invoke(context), rateLimiter, token),
                policy
            );

            // 4. 모든 종료 경로에서 완료 처리
            result.whenComplete((value, error) -> {
                registry.completeOperation(opId);
                if (error == null) {
                    log.debug("Operation {} completed", opId.getValue());
                    outcome.complete(value);
                } else {
                    Throwable failure = Failures.unwrap(error);
                    log.debug("Operation {} failed: {}", opId.getValue(), failure.toString());
                    outcome.completeExceptionally(failure);
                }
            });
        } catch (RuntimeException e) {
            registry.completeOperation(opId);
            throw e;
        }
        return outcome;
    }

    @Override
    public boolean cancel(OpId opId) {
        boolean cancelled = registry.cancelOperation(opId);
        if (cancelled) {
            log.info("Cancelled operation {}", opId.getValue());
        }
        return cancelled;
    }

    private void validateInput(OpId opId, ToolCall<?> call, ProgressSink sink) {
        if (opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
    }
}

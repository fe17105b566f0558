package com.ryuqq.toolgate.adapter.runner;

import com.ryuqq.toolgate.core.error.Failures;
import com.ryuqq.toolgate.core.error.OperationCancelledException;
import com.ryuqq.toolgate.core.retry.RetryPolicy;
import com.ryuqq.toolgate.core.spi.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Exponential Backoff 재시도 실행기.
 *
 * <p>실패한 비동기 작업을 {@link RetryPolicy}에 따라 재시도합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>매 시도 전 취소 여부 확인 (취소 시 OperationCancelledException)</li>
 *   <li>작업 실행 (동기 예외도 실패한 시도로 취급)</li>
 *   <li>성공 시 결과 반환</li>
 *   <li>마지막 시도이거나 재시도 불가 오류면 취소 여부와 무관하게 원본 오류로 실패</li>
 *   <li>재시도가 남았지만 취소된 경우 다음 시도 없이 OperationCancelledException (원본 오류는 suppressed)</li>
 *   <li>listener.onRetry(error, attempt, delayMs) 호출</li>
 *   <li>취소 가능한 sleep 후 다음 시도</li>
 * </ol>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>시도는 엄격히 순차 실행 (이전 시도가 끝나기 전에 다음 시도가 시작되지 않음)</li>
 *   <li>최종 실패는 CompletionException 등으로 감싸지 않은 원본 오류</li>
 *   <li>sleep 중 취소되면 타이머를 해제하고 즉시 실패</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RetryExecutor retry = new RetryExecutor(scheduler);
 * RetryPolicy policy = new RetryPolicy()
 *     .withRetryCondition(error -&gt; error instanceof ServerBusyException)
 *     .withCancellationToken(token);
 *
 * retry.execute(() -&gt; client.fetchTask(taskId), policy)
 *     .thenAccept(task -&gt; ...);
 * </pre>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final CancellableSleep sleep;

    /**
     * 생성자.
     *
     * @param scheduler 재시도 간 대기 타이머
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    public RetryExecutor(Scheduler scheduler) {
        this.sleep = new CancellableSleep(scheduler);
    }

    /**
     * 기본 정책(3회, 1000ms부터 2배, 상한 30000ms)으로 실행.
     *
     * @param operation 재시도 대상 작업
     * @param <T> 결과 타입
     * @return 결과 future
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation) {
        return execute(operation, new RetryPolicy());
    }

    /**
     * 정책에 따라 실행.
     *
     * @param operation 재시도 대상 작업
     * @param policy 재시도 정책
     * @param <T> 결과 타입
     * @return 결과 future (최종 실패 시 마지막 원본 오류)
     * @throws IllegalArgumentException operation 또는 policy가 null인 경우
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, policy, BackoffCalculator.from(policy), 1, result);
        return result;
    }

    private <T> void attempt(
        Supplier<CompletableFuture<T>> operation,
        RetryPolicy policy,
        BackoffCalculator backoff,
        int attempt,
        CompletableFuture<T> result
    ) {
        try {
            policy.cancellationToken().throwIfCancellationRequested("Operation");
        } catch (OperationCancelledException e) {
            result.completeExceptionally(e);
            return;
        }

        CompletableFuture<T> future;
        try {
            future = operation.get();
            if (future == null) {
                future = CompletableFuture.failedFuture(
                    new IllegalStateException("operation returned null future"));
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable failure = Failures.unwrap(error);
            try {
                onFailure(operation, policy, backoff, attempt, result, failure);
            } catch (RuntimeException e) {
                if (e != failure) {
                    e.addSuppressed(failure);
                }
                result.completeExceptionally(e);
            }
        });
    }

    private <T> void onFailure(
        Supplier<CompletableFuture<T>> operation,
        RetryPolicy policy,
        BackoffCalculator backoff,
        int attempt,
        CompletableFuture<T> result,
        Throwable failure
    ) {
        if (attempt >= policy.maxAttempts() || !policy.isRetryable(failure)) {
            log.debug("Giving up after attempt {}/{}: {}", attempt, policy.maxAttempts(), failure.toString());
            result.completeExceptionally(failure);
            return;
        }
        // the final error always wins; cancellation only stops the next attempt
        if (policy.cancellationToken().isCancellationRequested()) {
            result.completeExceptionally(asCancellation(failure));
            return;
        }

        long delayMs = backoff.calculate(attempt);
        policy.listener().onRetry(failure, attempt, delayMs);
        log.debug("Attempt {}/{} failed, retrying in {}ms: {}",
            attempt, policy.maxAttempts(), delayMs, failure.toString());

        sleep.sleep(delayMs, policy.cancellationToken()).whenComplete((ignored, sleepError) -> {
            if (sleepError != null) {
                result.completeExceptionally(Failures.unwrap(sleepError));
                return;
            }
            attempt(operation, policy, backoff, attempt + 1, result);
        });
    }

    private static Throwable asCancellation(Throwable failure) {
        if (failure instanceof OperationCancelledException) {
            return failure;
        }
        OperationCancelledException cancelled = new OperationCancelledException("Operation was cancelled");
        cancelled.addSuppressed(failure);
        return cancelled;
    }
}

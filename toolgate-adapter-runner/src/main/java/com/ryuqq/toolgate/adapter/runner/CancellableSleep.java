package com.ryuqq.toolgate.adapter.runner;

import com.ryuqq.toolgate.core.cancel.CancellationRegistration;
import com.ryuqq.toolgate.core.cancel.CancellationToken;
import com.ryuqq.toolgate.core.error.OperationCancelledException;
import com.ryuqq.toolgate.core.spi.Scheduler;

import java.util.concurrent.CompletableFuture;

/**
 * 취소 가능한 비동기 sleep.
 *
 * <p>취소되면 예약된 타이머를 해제하고 {@link OperationCancelledException}으로 실패합니다.
 * 정상 만료되면 취소 콜백 등록을 해제합니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class CancellableSleep {

    private final Scheduler scheduler;

    /**
     * 생성자.
     *
     * @param scheduler 타이머
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    public CancellableSleep(Scheduler scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    /**
     * 지정 시간 뒤 완료되는 future 반환.
     *
     * @param delayMs 대기 시간 (밀리초, 0이면 즉시 완료)
     * @param cancellationToken 취소 토큰
     * @return 대기 완료 future (취소 시 OperationCancelledException으로 실패)
     * @throws IllegalArgumentException delayMs가 음수이거나 cancellationToken이 null인 경우
     */
    public CompletableFuture<Void> sleep(long delayMs, CancellationToken cancellationToken) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must not be negative (current: " + delayMs + ")");
        }
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
        if (cancellationToken.isCancellationRequested()) {
            return CompletableFuture.failedFuture(cancelled());
        }
        if (delayMs == 0) {
            return CompletableFuture.completedFuture(null);
        }

        Sleeper sleeper = new Sleeper();
        sleeper.task = scheduler.schedule(sleeper::wake, delayMs);
        sleeper.attach(cancellationToken.onCancel(sleeper::abort));
        return sleeper.future;
    }

    private static OperationCancelledException cancelled() {
        return new OperationCancelledException("Sleep was cancelled");
    }

    private static final class Sleeper {

        private final CompletableFuture<Void> future = new CompletableFuture<>();
        private volatile Scheduler.ScheduledTask task;
        private volatile CancellationRegistration registration;

        void wake() {
            if (future.complete(null)) {
                CancellationRegistration current = registration;
                if (current != null) {
                    current.unregister();
                }
            }
        }

        void abort() {
            Scheduler.ScheduledTask current = task;
            if (current != null) {
                current.cancel();
            }
            future.completeExceptionally(cancelled());
        }

        void attach(CancellationRegistration registration) {
            this.registration = registration;
            if (future.isDone()) {
                registration.unregister();
            }
        }
    }
}

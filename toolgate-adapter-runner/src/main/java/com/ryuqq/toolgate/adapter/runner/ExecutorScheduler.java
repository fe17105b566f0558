package com.ryuqq.toolgate.adapter.runner;

import com.ryuqq.toolgate.core.spi.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link ScheduledExecutorService} 기반 {@link Scheduler} 구현.
 *
 * <p>{@link #create(String)}로 만든 인스턴스는 자체 daemon 스레드를 소유하며
 * {@link #shutdown()}으로 정리합니다. 외부 executor를 주입한 경우 종료는 호출부 책임입니다.</p>
 *
 * <p>예약 작업에서 발생한 예외는 ERROR 로그로 남긴 뒤 다시 던집니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class ExecutorScheduler implements Scheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorScheduler.class);

    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * 외부 executor로 생성.
     *
     * @param executor 타이머 executor
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public ExecutorScheduler(ScheduledExecutorService executor) {
        this(executor, false);
    }

    private ExecutorScheduler(ScheduledExecutorService executor, boolean ownsExecutor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * 단일 daemon 스레드를 소유하는 스케줄러 생성.
     *
     * <p>취소된 작업은 즉시 큐에서 제거됩니다.</p>
     *
     * @param threadName 스레드 이름
     * @return ExecutorScheduler
     */
    public static ExecutorScheduler create(String threadName) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return new ExecutorScheduler(executor, true);
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must not be negative (current: " + delayMs + ")");
        }
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled task failed", e);
                throw e;
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    /**
     * 실행을 기다리는 예약 작업 수 (진단용).
     *
     * @return 대기 작업 수, executor가 {@link ScheduledThreadPoolExecutor}가 아니면 -1
     */
    public int getQueuedTaskCount() {
        if (executor instanceof ScheduledThreadPoolExecutor) {
            return ((ScheduledThreadPoolExecutor) executor).getQueue().size();
        }
        return -1;
    }

    /**
     * 소유한 executor 종료 (대기 중인 작업은 실행되지 않음).
     */
    public void shutdown() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}

package com.ryuqq.toolgate.adapter.runner;

import com.ryuqq.toolgate.core.spi.Scheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExecutorScheduler 유닛 테스트 (실제 스레드 사용).
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
@DisplayName("ExecutorScheduler 테스트")
class ExecutorSchedulerTest {

    private ExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = ExecutorScheduler.create("test-timer");
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("예약한 작업이 지연 후 실행된다")
    void 예약_작업_실행() throws InterruptedException {
        // given
        CountDownLatch latch = new CountDownLatch(1);

        // when
        scheduler.schedule(latch::countDown, 20);

        // then
        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("취소한 작업은 실행되지 않는다")
    void 취소_작업_미실행() throws InterruptedException {
        // given
        AtomicBoolean ran = new AtomicBoolean();
        Scheduler.ScheduledTask task = scheduler.schedule(() -> ran.set(true), 100);

        // when
        boolean cancelled = task.cancel();
        Thread.sleep(200);

        // then
        assertThat(cancelled).isTrue();
        assertThat(ran.get()).isFalse();
    }

    @Test
    @DisplayName("취소한 작업은 실행 시점을 기다리지 않고 큐에서 바로 제거된다")
    void 취소_작업_큐_즉시_제거() {
        // given
        Scheduler.ScheduledTask task = scheduler.schedule(() -> { }, TimeUnit.SECONDS.toMillis(60));
        assertThat(scheduler.getQueuedTaskCount()).isEqualTo(1);

        // when
        boolean cancelled = task.cancel();

        // then
        assertThat(cancelled).isTrue();
        assertThat(scheduler.getQueuedTaskCount()).isZero();
    }

    @Test
    @DisplayName("작업이 예외를 던져도 이후 작업은 계속 실행된다")
    void 예외_후_계속_실행() throws InterruptedException {
        // given
        CountDownLatch latch = new CountDownLatch(1);

        // when
        scheduler.schedule(() -> {
            throw new IllegalStateException("boom");
        }, 0);
        scheduler.schedule(latch::countDown, 10);

        // then
        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("음수 지연은 IllegalArgumentException이 발생한다")
    void 음수_지연_예외() {
        assertThatThrownBy(() -> scheduler.schedule(() -> { }, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

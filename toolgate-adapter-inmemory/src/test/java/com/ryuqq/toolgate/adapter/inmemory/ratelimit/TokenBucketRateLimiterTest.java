package com.ryuqq.toolgate.adapter.inmemory.ratelimit;

import com.ryuqq.toolgate.core.cancel.CancellationSource;
import com.ryuqq.toolgate.core.cancel.CancellationToken;
import com.ryuqq.toolgate.core.protection.RateLimiterConfig;
import com.ryuqq.toolgate.core.spi.Scheduler;
import com.ryuqq.toolgate.testkit.time.ManualClock;
import com.ryuqq.toolgate.testkit.time.ManualScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * TokenBucketRateLimiter 유닛 테스트.
 *
 * <p>계약 테스트가 다루지 않는 구현 세부(드리프트 없는 보충, 대기열 관리, 생성자 검증)를 검증합니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
@DisplayName("TokenBucketRateLimiter 테스트")
class TokenBucketRateLimiterTest {

    private ManualClock clock;
    private ManualScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        scheduler = new ManualScheduler(clock);
    }

    @Test
    @DisplayName("config가 null이면 IllegalArgumentException이 발생한다")
    void 생성자_config_null_예외() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(null, clock, scheduler))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }

    @Test
    @DisplayName("scheduler가 null이면 IllegalArgumentException이 발생한다")
    void 생성자_scheduler_null_예외() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(new RateLimiterConfig(), clock, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scheduler");
    }

    @Test
    @DisplayName("1ms 단위로 나누어 시간을 진행해도 보충량이 누적 오차 없이 정확하다")
    void 잘게_나눈_시간_진행에도_드리프트_없음() {
        // given
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(5, 0.3), clock, scheduler);
        while (limiter.acquire()) {
            // 버킷 비우기
        }

        // when: 10초를 1ms씩 진행하며 매번 관찰
        for (int i = 0; i < 10_000; i++) {
            clock.advanceMillis(1);
            limiter.getAvailableTokens();
        }

        // then: 0.3 * 10 = 3개
        assertThat(limiter.getAvailableTokens()).isEqualTo(3);
    }

    @Test
    @DisplayName("소수 보충 속도에서 다음 토큰까지 시간은 올림 처리된다")
    void 소수_보충속도_대기시간_올림() {
        // given
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(1, 0.3), clock, scheduler);
        limiter.acquire();

        // when
        long waitMs = limiter.getTimeUntilNextToken();

        // then: ceil(1 / 0.3 * 1000) = 3334
        assertThat(waitMs).isEqualTo(3334);
    }

    @Test
    @DisplayName("대기자가 여러 명이어도 drain 타이머는 하나만 예약된다")
    void 대기자_여러명_타이머_하나() {
        // given
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(1, 1.0), clock, scheduler);
        limiter.acquire();

        // when
        limiter.waitForToken(CancellationToken.none());
        limiter.waitForToken(CancellationToken.none());
        limiter.waitForToken(CancellationToken.none());

        // then
        assertThat(scheduler.pendingTaskCount()).isEqualTo(1);
        assertThat(limiter.getQueuedWaiterCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("한 번에 여러 토큰이 보충되면 대기자 여러 명이 한 번의 drain으로 도착 순서대로 통과한다")
    void 여러_토큰_보충시_한번에_여러_대기자_통과() {
        // given
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(3, 1.0), clock, scheduler);
        while (limiter.acquire()) {
            // 버킷 비우기
        }
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            int index = i;
            limiter.waitForToken(CancellationToken.none()).thenRun(() -> order.add(index));
        }

        // when: 타이머를 건너뛰고 시계만 3초 진행 후 drain
        clock.advanceMillis(3000);
        scheduler.runDueTasks();

        // then
        assertThat(order).containsExactly(0, 1, 2);
        assertThat(limiter.getQueuedWaiterCount()).isZero();
        assertThat(limiter.getAvailableTokens()).isZero();
    }

    @Test
    @DisplayName("마지막 대기자가 취소되면 예약된 타이머가 취소된다")
    void 마지막_대기자_취소시_타이머_취소() {
        // given
        Scheduler.ScheduledTask task = mock(Scheduler.ScheduledTask.class);
        Scheduler mockScheduler = (runnable, delayMs) -> task;
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(1, 1.0), clock, mockScheduler);
        limiter.acquire();
        CancellationSource source = new CancellationSource();
        CompletableFuture<Void> wait = limiter.waitForToken(source.token());

        // when
        source.cancel();

        // then
        verify(task).cancel();
        assertThat(wait).isCompletedExceptionally();
        assertThat(limiter.getQueuedWaiterCount()).isZero();
    }

    @Test
    @DisplayName("토큰이 있으면 waitForToken은 타이머를 예약하지 않는다")
    void 토큰_있으면_타이머_예약_안함() {
        // given
        Scheduler mockScheduler = mock(Scheduler.class);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(), clock, mockScheduler);

        // when
        CompletableFuture<Void> wait = limiter.waitForToken(CancellationToken.none());

        // then
        assertThat(wait).isCompleted();
        verify(mockScheduler, never()).schedule(any(), anyLong());
    }

    @Test
    @DisplayName("reset은 대기 중인 대기자에게 즉시 토큰을 나눠준다")
    void reset_대기자_즉시_통과() {
        // given
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(2, 0.1), clock, scheduler);
        limiter.acquire();
        limiter.acquire();
        CompletableFuture<Void> first = limiter.waitForToken(CancellationToken.none());
        CompletableFuture<Void> second = limiter.waitForToken(CancellationToken.none());

        // when
        limiter.reset();

        // then
        assertThat(first).isCompleted();
        assertThat(second).isCompleted();
        assertThat(scheduler.pendingTaskCount()).isZero();
        assertThat(limiter.getAvailableTokens()).isZero();
    }

    @Test
    @DisplayName("타이머 예약이 거부되면 대기자를 남기지 않고 실패하며 이후 acquire는 정상 동작한다")
    void 타이머_예약_거부시_대기자_제거() {
        // given
        RejectedExecutionException rejected = new RejectedExecutionException("scheduler is shut down");
        Scheduler closedScheduler = (runnable, delayMs) -> {
            throw rejected;
        };
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(1, 1.0), clock, closedScheduler);
        limiter.acquire();

        // when
        CompletableFuture<Void> wait = limiter.waitForToken(CancellationToken.none());

        // then
        assertThat(catchThrowable(wait::get).getCause()).isSameAs(rejected);
        assertThat(limiter.getQueuedWaiterCount()).isZero();
        clock.advanceMillis(1000);
        assertThat(limiter.acquire()).isTrue();
    }

    @Test
    @DisplayName("부여된 토큰을 받은 대기자가 이미 완료되었으면 토큰을 다음 대기자에게 바로 넘긴다")
    void 이미_완료된_대기자_토큰_즉시_재부여() {
        // given
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(2, 1.0), clock, scheduler);
        limiter.acquire();
        limiter.acquire();
        CompletableFuture<Void> first = limiter.waitForToken(CancellationToken.none());
        CompletableFuture<Void> second = limiter.waitForToken(CancellationToken.none());
        CompletableFuture<Void> third = limiter.waitForToken(CancellationToken.none());
        // first가 통과하는 순간 호출자가 second를 포기한다
        first.thenRun(() -> second.cancel(false));

        // when: 두 토큰이 한 번의 drain으로 first, second에 부여된다
        clock.advanceMillis(2000);
        scheduler.runDueTasks();

        // then
        assertThat(first).isCompleted();
        assertThat(second).isCancelled();
        assertThat(third).isCompleted();
        assertThat(limiter.getQueuedWaiterCount()).isZero();
        assertThat(scheduler.pendingTaskCount()).isZero();
        assertThat(limiter.getAvailableTokens()).isZero();
    }

    @Test
    @DisplayName("cancellationToken이 null이면 IllegalArgumentException이 발생한다")
    void waitForToken_null_토큰_예외() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(), clock, scheduler);

        assertThatThrownBy(() -> limiter.waitForToken(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

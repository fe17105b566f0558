package com.ryuqq.toolgate.core.spi;

/**
 * 취소 가능한 타이머 SPI.
 *
 * <p>Rate Limiter 대기와 재시도 간 sleep이 이 SPI로 콜백을 예약합니다.
 * 대기가 취소되면 예약된 작업을 반드시 {@link ScheduledTask#cancel()}로 해제합니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public interface Scheduler {

    /**
     * 지연 실행 예약.
     *
     * @param task 실행할 작업
     * @param delayMs 지연 시간 (밀리초, 0 이상)
     * @return 예약 핸들
     * @throws IllegalArgumentException task가 null이거나 delayMs가 음수인 경우
     */
    ScheduledTask schedule(Runnable task, long delayMs);

    /**
     * 예약 핸들.
     */
    interface ScheduledTask {

        /**
         * 아직 실행되지 않은 작업 취소.
         *
         * @return 실행 전에 취소되었으면 true
         */
        boolean cancel();
    }
}

package com.ryuqq.toolgate.core.progress;

/**
 * 진행률 알림 전송 대상 (예: MCP {@code notifications/progress}).
 *
 * <p>전송 실패(전송 채널 종료 등)를 삼킬지는 sink 경계에서 결정합니다.
 * {@link ProgressSinks#bestEffort(ProgressSink)}로 감싸면 실패가 Operation 결과에 영향을 주지 않습니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressSink {

    /**
     * 알림 전송.
     *
     * @param notification 진행률 알림
     */
    void send(ProgressNotification notification);
}

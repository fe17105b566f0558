package com.ryuqq.toolgate.core.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProgressSink} 팩토리.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class ProgressSinks {

    private static final Logger log = LoggerFactory.getLogger(ProgressSinks.class);

    private static final ProgressSink DISCARDING = notification -> { };

    private ProgressSinks() {
    }

    /**
     * 모든 알림을 버리는 sink.
     *
     * @return 공유 인스턴스
     */
    public static ProgressSink discarding() {
        return DISCARDING;
    }

    /**
     * 전송 실패를 경고 로그로 남기고 삼키는 sink.
     *
     * <p>진행률 전송은 best-effort이므로 전송 실패가 Operation의 성공/실패를 바꾸면 안 됩니다.
     * 이 경계가 ToolGate에서 오류를 삼키는 유일한 지점입니다.</p>
     *
     * @param delegate 실제 전송 sink
     * @return 실패를 격리하는 sink
     * @throws IllegalArgumentException delegate가 null인 경우
     */
    public static ProgressSink bestEffort(ProgressSink delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        return notification -> {
            try {
                delegate.send(notification);
            } catch (RuntimeException e) {
                log.warn("Dropped progress notification for {}: {}",
                    notification.progressToken(), e.getMessage(), e);
            }
        };
    }
}

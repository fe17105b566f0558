package com.ryuqq.toolgate.core.progress;

import com.ryuqq.toolgate.core.model.OpId;

/**
 * 장시간 실행 도구(영상/오디오 생성, 배치 처리)의 진행률 보고자.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public interface ProgressReporter {

    /**
     * 진행률 보고.
     *
     * @param progress 현재 진행량
     * @param total 전체량
     * @param message 메시지 (null 가능)
     */
    void report(double progress, double total, String message);

    /**
     * 메시지 없이 진행률 보고.
     *
     * @param progress 현재 진행량
     * @param total 전체량
     */
    default void report(double progress, double total) {
        report(progress, total, null);
    }

    /**
     * Operation ID로 태깅된 알림을 sink로 전달하는 보고자 생성.
     *
     * <p>보고자는 sink 예외를 삼키지 않습니다. 전송 실패 격리는 sink 쪽 책임입니다.</p>
     *
     * @param opId Operation ID (progressToken으로 사용)
     * @param sink 알림 전송 대상
     * @return ProgressReporter
     * @throws IllegalArgumentException opId 또는 sink가 null인 경우
     */
    static ProgressReporter forOperation(OpId opId, ProgressSink sink) {
        if (opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        String progressToken = opId.getValue();
        return (progress, total, message) ->
            sink.send(new ProgressNotification(progressToken, progress, total, message));
    }
}

package com.ryuqq.toolgate.application.dispatcher;

import com.ryuqq.toolgate.core.contract.ToolCall;
import com.ryuqq.toolgate.core.model.OpId;
import com.ryuqq.toolgate.core.progress.ProgressSink;

import java.util.concurrent.CompletableFuture;

/**
 * 도구 호출 디스패처.
 *
 * <p>모든 외부 도구 호출은 이 포트를 통해 원격 API에 도달합니다.
 * 취소 가능한 Operation 등록, Rate Limit 대기, 재시도, 진행률 전달, Operation 완료 처리를
 * 한 번의 호출로 묶습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OpId opId = OpId.of(request.progressToken());
 * dispatcher.dispatch(opId, ctx -&gt; client.generateImage(args, ctx), notifier::send)
 *     .whenComplete((result, error) -&gt; respond(result, error));
 *
 * // 클라이언트 취소 알림 수신 시
 * dispatcher.cancel(opId);
 * </pre>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public interface ToolDispatcher {

    /**
     * 도구 호출 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>opId로 취소 가능한 Operation 등록</li>
     *   <li>전송 실패를 격리하는 진행률 보고자 생성</li>
     *   <li>재시도 루프 실행: 매 시도 전 Rate Limit 토큰 대기 후 원격 호출</li>
     *   <li>성공, 실패, 취소 어느 경로로 끝나도 Operation 완료 처리</li>
     * </ol>
     *
     * @param opId Operation ID (진행률 알림의 progressToken으로도 사용)
     * @param call 원격 호출
     * @param sink 진행률 알림 전송 대상
     * @param <T> 결과 타입
     * @return 호출 결과 (재시도 소진 시 마지막 원본 오류로 실패)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    <T> CompletableFuture<T> dispatch(OpId opId, ToolCall<T> call, ProgressSink sink);

    /**
     * 무작위 Operation ID로 도구 호출 실행.
     *
     * <p>클라이언트가 progressToken을 보내지 않은 요청에 사용합니다.</p>
     *
     * @param call 원격 호출
     * @param sink 진행률 알림 전송 대상
     * @param <T> 결과 타입
     * @return 호출 결과
     */
    default <T> CompletableFuture<T> dispatch(ToolCall<T> call, ProgressSink sink) {
        return dispatch(OpId.random(), call, sink);
    }

    /**
     * 진행 중인 도구 호출 취소.
     *
     * @param opId Operation ID
     * @return 진행 중인 호출을 찾아 취소했으면 true
     */
    boolean cancel(OpId opId);
}

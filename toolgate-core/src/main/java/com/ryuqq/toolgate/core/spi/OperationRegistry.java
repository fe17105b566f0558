package com.ryuqq.toolgate.core.spi;

import com.ryuqq.toolgate.core.cancel.CancellationToken;
import com.ryuqq.toolgate.core.model.OpId;
import com.ryuqq.toolgate.core.progress.ProgressReporter;
import com.ryuqq.toolgate.core.progress.ProgressSink;

/**
 * 진행 중 Operation 레지스트리 SPI.
 *
 * <p>모든 진행 중 도구 호출에 취소와 진행률 보고를 위한 식별자를 부여합니다.
 * 레지스트리는 취소 컨텍스트의 유일한 소유자입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>id당 최대 하나의 레코드</li>
 *   <li>생성된 모든 Operation은 모든 종료 경로(성공, 예외, 취소)에서 정확히 한 번 완료되어야 함
 *       (누락 시 자원 누수)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CancellationToken token = registry.createCancellableOperation(opId);
 * try {
 *     handler.handle(args, token);
 * } finally {
 *     registry.completeOperation(opId);
 * }
 * }</pre>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public interface OperationRegistry {

    /**
     * 취소 가능한 Operation 등록.
     *
     * <p>같은 id가 이미 등록되어 있으면 새 컨텍스트로 덮어씁니다 (호출부의 논리 오류지만 상태는 손상되지 않음).</p>
     *
     * @param opId Operation ID
     * @return 이 Operation의 취소 토큰
     * @throws IllegalArgumentException opId가 null인 경우
     */
    CancellationToken createCancellableOperation(OpId opId);

    /**
     * Operation 취소.
     *
     * <p>취소 토큰을 발화하고 레코드를 제거합니다.</p>
     *
     * @param opId Operation ID
     * @return 등록된 Operation을 찾아 취소했으면 true, 없으면 false
     */
    boolean cancelOperation(OpId opId);

    /**
     * Operation 완료 처리 (멱등).
     *
     * <p>무조건 레코드를 제거합니다. 두 번 호출하거나 알 수 없는 id로 호출해도 예외가 발생하지 않습니다.</p>
     *
     * @param opId Operation ID
     */
    void completeOperation(OpId opId);

    /**
     * Operation 등록 여부 확인.
     *
     * @param opId Operation ID
     * @return 진행 중이면 true
     */
    boolean isActive(OpId opId);

    /**
     * 진행 중 Operation 수 (진단 및 종료 조율용).
     *
     * @return 등록된 Operation 수
     */
    int getActiveOperationCount();

    /**
     * Operation ID로 태깅된 진행률 보고자 생성.
     *
     * <p>보고자는 레지스트리 상태를 읽거나 바꾸지 않습니다.</p>
     *
     * @param opId Operation ID
     * @param sink 알림 전송 대상
     * @return ProgressReporter
     */
    default ProgressReporter createProgressReporter(OpId opId, ProgressSink sink) {
        return ProgressReporter.forOperation(opId, sink);
    }
}

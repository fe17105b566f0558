package com.ryuqq.toolgate.core.contract;

import com.ryuqq.toolgate.core.cancel.CancellationToken;
import com.ryuqq.toolgate.core.model.OpId;
import com.ryuqq.toolgate.core.progress.ProgressReporter;

/**
 * 도구 호출에 전달되는 실행 컨텍스트.
 *
 * <p>도구 핸들러는 cancellationToken을 원격 호출과 폴링 루프에 그대로 전달해야 합니다.</p>
 *
 * @param opId Operation ID
 * @param cancellationToken 취소 토큰
 * @param progress 진행률 보고자
 * @author ToolGate Team
 * @since 1.0.0
 */
public record ToolContext(
    OpId opId,
    CancellationToken cancellationToken,
    ProgressReporter progress
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public ToolContext {
        if (opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken cannot be null");
        }
        if (progress == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }
    }
}

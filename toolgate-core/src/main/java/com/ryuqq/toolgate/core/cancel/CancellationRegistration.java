package com.ryuqq.toolgate.core.cancel;

/**
 * 취소 콜백 등록 핸들.
 *
 * <p>대기가 정상 완료되면 {@link #unregister()}로 콜백을 해제해야
 * 오래 사는 토큰에 콜백이 누적되지 않습니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellationRegistration {

    /**
     * 아무 것도 하지 않는 등록 핸들.
     */
    CancellationRegistration EMPTY = () -> { };

    /**
     * 콜백 등록 해제 (멱등).
     */
    void unregister();
}

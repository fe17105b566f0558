package com.ryuqq.toolgate.core.cancel;

import com.ryuqq.toolgate.core.error.OperationCancelledException;

/**
 * 취소 신호의 수신 측.
 *
 * <p>Rate Limiter 대기, 재시도 간 sleep 등 모든 대기 지점은 이 토큰을 받아
 * 취소를 관찰합니다. 토큰은 바깥 호출부에서 안쪽 대기 지점까지 명시적으로 전달됩니다
 * (limiter → retry → sleep).</p>
 *
 * <p>{@link #none()}은 절대 취소되지 않는 토큰입니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null);

    private final CancellationSource source;

    CancellationToken(CancellationSource source) {
        this.source = source;
    }

    /**
     * 절대 취소되지 않는 토큰.
     *
     * @return 공유 인스턴스
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * 취소 요청 여부 확인.
     *
     * @return 취소된 경우 true
     */
    public boolean isCancellationRequested() {
        return source != null && source.isCancelled();
    }

    /**
     * 취소 시 실행할 콜백 등록.
     *
     * <p>이미 취소된 토큰이면 콜백을 즉시 실행합니다.</p>
     *
     * @param callback 취소 콜백
     * @return 등록 해제 핸들
     * @throws IllegalArgumentException callback이 null인 경우
     */
    public CancellationRegistration onCancel(Runnable callback) {
        if (source == null) {
            if (callback == null) {
                throw new IllegalArgumentException("callback cannot be null");
            }
            return CancellationRegistration.EMPTY;
        }
        return source.register(callback);
    }

    /**
     * 취소된 경우 {@link OperationCancelledException} 발생.
     *
     * @param what 취소된 대상 설명 (예외 메시지용)
     * @throws OperationCancelledException 취소된 경우
     */
    public void throwIfCancellationRequested(String what) {
        if (isCancellationRequested()) {
            throw new OperationCancelledException(what + " was cancelled");
        }
    }
}

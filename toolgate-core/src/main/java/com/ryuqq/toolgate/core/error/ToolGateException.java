package com.ryuqq.toolgate.core.error;

/**
 * ToolGate 운영 오류의 공통 상위 타입.
 *
 * <p>모든 하위 예외는 복구 가능한 일시적 조건이며, 호출부가 {@link ErrorCode}로 분기합니다.
 * 설정 오류는 이 계층에 속하지 않고 생성 시점에 {@link IllegalArgumentException}으로 실패합니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public abstract class ToolGateException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ToolGateException(ErrorCode errorCode, String message) {
        super(message == null || message.isBlank() ? errorCode.getDefaultMessage() : message);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return ErrorCode (non-null)
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

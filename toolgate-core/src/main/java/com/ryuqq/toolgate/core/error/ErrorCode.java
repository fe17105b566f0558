package com.ryuqq.toolgate.core.error;

/**
 * ToolGate 오류 코드.
 *
 * <p>디스패처가 프로토콜 수준 응답(JSON-RPC error)으로 변환할 때 사용하는 숫자 코드를 함께 가집니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 요청 속도 제한 초과 (재시도 가능).
     */
    RATE_LIMIT_EXCEEDED(-32_101, "Rate limit exceeded"),

    /**
     * 대기 중 작업 취소.
     */
    OPERATION_CANCELLED(-32_800, "Operation cancelled");

    private final int code;
    private final String defaultMessage;

    ErrorCode(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    /**
     * JSON-RPC 오류 코드 조회.
     *
     * @return 숫자 코드
     */
    public int getCode() {
        return code;
    }

    /**
     * 기본 오류 메시지 조회.
     *
     * @return 기본 메시지
     */
    public String getDefaultMessage() {
        return defaultMessage;
    }
}

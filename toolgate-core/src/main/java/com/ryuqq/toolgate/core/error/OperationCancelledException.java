package com.ryuqq.toolgate.core.error;

/**
 * 대기 중 취소 토큰이 발화됨.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public class OperationCancelledException extends ToolGateException {

    public OperationCancelledException(String message) {
        super(ErrorCode.OPERATION_CANCELLED, message);
    }
}

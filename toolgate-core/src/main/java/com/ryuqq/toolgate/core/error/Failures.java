package com.ryuqq.toolgate.core.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 비동기 실패 원인 추출 유틸리티.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class Failures {

    private Failures() {
    }

    /**
     * {@link CompletionException}/{@link ExecutionException} 래퍼를 벗겨 원본 오류를 반환.
     *
     * <p>재시도 소진 시 호출부가 원본 오류 타입으로 분기할 수 있도록 합니다.</p>
     *
     * @param error 실패 원인
     * @return 가장 안쪽의 원본 오류 (래퍼에 cause가 없으면 래퍼 자신)
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

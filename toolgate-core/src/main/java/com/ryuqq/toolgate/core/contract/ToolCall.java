package com.ryuqq.toolgate.core.contract;

import java.util.concurrent.CompletableFuture;

/**
 * 보호 체인 안에서 실행되는 원격 호출.
 *
 * <p>ToolGate에게 호출 내용은 불투명합니다. 재시도 시 같은 컨텍스트로 여러 번 호출될 수 있습니다.</p>
 *
 * @param <T> 결과 타입
 * @author ToolGate Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ToolCall<T> {

    /**
     * 호출 실행.
     *
     * @param context 실행 컨텍스트
     * @return 결과 future
     */
    CompletableFuture<T> invoke(ToolContext context);
}

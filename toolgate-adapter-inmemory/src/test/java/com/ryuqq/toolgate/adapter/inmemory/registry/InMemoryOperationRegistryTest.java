package com.ryuqq.toolgate.adapter.inmemory.registry;

import com.ryuqq.toolgate.core.cancel.CancellationToken;
import com.ryuqq.toolgate.core.model.OpId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryOperationRegistry 유닛 테스트.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
@DisplayName("InMemoryOperationRegistry 테스트")
class InMemoryOperationRegistryTest {

    @Test
    @DisplayName("opId가 null이면 IllegalArgumentException이 발생한다")
    void create_null_예외() {
        InMemoryOperationRegistry registry = new InMemoryOperationRegistry();

        assertThatThrownBy(() -> registry.createCancellableOperation(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("취소 콜백 안에서 Operation은 이미 비활성 상태로 보인다")
    void 취소_콜백_시점_비활성() {
        // given
        InMemoryOperationRegistry registry = new InMemoryOperationRegistry();
        OpId opId = OpId.of("op-1");
        CancellationToken token = registry.createCancellableOperation(opId);
        AtomicBoolean activeDuringCallback = new AtomicBoolean(true);
        token.onCancel(() -> activeDuringCallback.set(registry.isActive(opId)));

        // when
        registry.cancelOperation(opId);

        // then
        assertThat(activeDuringCallback.get()).isFalse();
    }

    @Test
    @DisplayName("여러 스레드가 생성과 완료를 반복해도 남는 레코드가 없다")
    void 동시_생성_완료_누수_없음() throws Exception {
        // given
        InMemoryOperationRegistry registry = new InMemoryOperationRegistry();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        // when
        try {
            for (int i = 0; i < 1000; i++) {
                OpId opId = OpId.of("op-" + i);
                futures.add(CompletableFuture.runAsync(() -> {
                    registry.createCancellableOperation(opId);
                    registry.completeOperation(opId);
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        // then
        assertThat(registry.getActiveOperationCount()).isZero();
    }
}

package com.ryuqq.toolgate.core.cancel;

import com.ryuqq.toolgate.core.error.OperationCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CancellationSource / CancellationToken 유닛 테스트.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
@DisplayName("CancellationSource 테스트")
class CancellationSourceTest {

    @Test
    @DisplayName("cancel() 호출 시 토큰이 취소 상태가 되고 콜백이 등록 순서대로 실행된다")
    void 취소시_콜백_순서대로_실행() {
        // given
        CancellationSource source = new CancellationSource();
        List<String> calls = new ArrayList<>();
        source.token().onCancel(() -> calls.add("first"));
        source.token().onCancel(() -> calls.add("second"));

        // when
        source.cancel();

        // then
        assertThat(source.isCancelled()).isTrue();
        assertThat(source.token().isCancellationRequested()).isTrue();
        assertThat(calls).containsExactly("first", "second");
    }

    @Test
    @DisplayName("cancel()을 여러 번 호출해도 콜백은 한 번만 실행된다")
    void 중복취소_콜백_한번() {
        // given
        CancellationSource source = new CancellationSource();
        AtomicInteger count = new AtomicInteger();
        source.token().onCancel(count::incrementAndGet);

        // when
        source.cancel();
        source.cancel();

        // then
        assertThat(count.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("등록 해제된 콜백은 실행되지 않는다")
    void 등록해제_콜백_미실행() {
        // given
        CancellationSource source = new CancellationSource();
        AtomicInteger count = new AtomicInteger();
        CancellationRegistration registration = source.token().onCancel(count::incrementAndGet);

        // when
        registration.unregister();
        source.cancel();

        // then
        assertThat(count.get()).isZero();
    }

    @Test
    @DisplayName("이미 취소된 토큰에 등록한 콜백은 즉시 실행된다")
    void 취소후_등록_즉시실행() {
        // given
        CancellationSource source = new CancellationSource();
        source.cancel();
        AtomicInteger count = new AtomicInteger();

        // when
        CancellationRegistration registration = source.token().onCancel(count::incrementAndGet);

        // then
        assertThat(count.get()).isEqualTo(1);
        assertThat(registration).isSameAs(CancellationRegistration.EMPTY);
    }

    @Test
    @DisplayName("콜백이 실패해도 나머지 콜백은 실행되고 첫 예외가 전파된다")
    void 콜백실패_나머지_실행() {
        // given
        CancellationSource source = new CancellationSource();
        AtomicInteger count = new AtomicInteger();
        source.token().onCancel(() -> {
            throw new IllegalStateException("first failure");
        });
        source.token().onCancel(count::incrementAndGet);

        // when / then
        assertThatThrownBy(source::cancel)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("first failure");
        assertThat(count.get()).isEqualTo(1);
        assertThat(source.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("none() 토큰은 취소되지 않으며 콜백을 실행하지 않는다")
    void none_토큰() {
        // given
        CancellationToken none = CancellationToken.none();
        AtomicInteger count = new AtomicInteger();

        // when
        CancellationRegistration registration = none.onCancel(count::incrementAndGet);

        // then
        assertThat(none.isCancellationRequested()).isFalse();
        assertThat(registration).isSameAs(CancellationRegistration.EMPTY);
        assertThat(count.get()).isZero();
        assertThatCode(() -> none.throwIfCancellationRequested("Sleep")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("throwIfCancellationRequested()는 취소된 경우 OperationCancelledException을 던진다")
    void throwIfCancellationRequested_취소시_예외() {
        // given
        CancellationSource source = new CancellationSource();
        source.cancel();

        // when / then
        assertThatThrownBy(() -> source.token().throwIfCancellationRequested("Sleep"))
            .isInstanceOf(OperationCancelledException.class)
            .hasMessage("Sleep was cancelled");
    }

    @Test
    @DisplayName("null 콜백은 IllegalArgumentException을 던진다")
    void null_콜백_예외() {
        CancellationSource source = new CancellationSource();

        assertThatThrownBy(() -> source.token().onCancel(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CancellationToken.none().onCancel(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

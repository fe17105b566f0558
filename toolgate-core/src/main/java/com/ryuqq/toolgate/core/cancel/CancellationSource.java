package com.ryuqq.toolgate.core.cancel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 취소 신호의 발신 측.
 *
 * <p>{@link #cancel()}을 호출하면 연결된 {@link CancellationToken}이 취소 상태가 되고,
 * 등록된 콜백이 등록 순서대로 한 번씩 실행됩니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>cancel()은 여러 번 호출해도 콜백을 한 번만 실행합니다.</li>
 *   <li>콜백은 락 밖에서 실행되므로 콜백 안에서 다른 락을 잡아도 교착되지 않습니다.</li>
 *   <li>이미 취소된 뒤 등록된 콜백은 등록 스레드에서 즉시 실행됩니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CancellationSource source = new CancellationSource();
 * limiter.waitForToken(source.token());
 *
 * // 클라이언트 취소 요청 수신 시
 * source.cancel();
 * }</pre>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class CancellationSource {

    private final Object lock = new Object();
    private final Map<Long, Runnable> callbacks = new LinkedHashMap<>();
    private final CancellationToken token = new CancellationToken(this);

    private volatile boolean cancelled;
    private long nextCallbackId;

    /**
     * 이 소스에 연결된 토큰 조회.
     *
     * @return CancellationToken (항상 동일 인스턴스)
     */
    public CancellationToken token() {
        return token;
    }

    /**
     * 취소 여부 확인.
     *
     * @return 취소된 경우 true
     */
    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * 취소 신호 발신.
     *
     * <p>콜백 실행 중 예외가 발생해도 나머지 콜백은 모두 실행되며,
     * 첫 번째 예외에 이후 예외를 suppressed로 붙여 마지막에 다시 던집니다.</p>
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks.values());
            callbacks.clear();
        }

        RuntimeException failure = null;
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    CancellationRegistration register(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        long id;
        synchronized (lock) {
            if (!cancelled) {
                id = nextCallbackId++;
                callbacks.put(id, callback);
                return () -> unregister(id);
            }
        }
        callback.run();
        return CancellationRegistration.EMPTY;
    }

    private void unregister(long id) {
        synchronized (lock) {
            callbacks.remove(id);
        }
    }
}

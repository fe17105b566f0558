package com.ryuqq.toolgate.core.clock;

/**
 * {@link System#nanoTime()} 기반 시스템 시계.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class SystemClock implements Clock {

    private static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}

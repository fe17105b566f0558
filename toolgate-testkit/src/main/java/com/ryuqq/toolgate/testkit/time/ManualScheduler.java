package com.ryuqq.toolgate.testkit.time;

import com.ryuqq.toolgate.core.spi.Scheduler;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Deterministic {@link Scheduler} driven by a {@link ManualClock}.
 *
 * <p>Nothing runs until the test calls {@link #advance(long)} or {@link #runDueTasks()}.
 * Tasks run on the calling thread in due-time order; tasks with the same due time run in the
 * order they were scheduled. A task scheduled while advancing runs in the same call when it falls
 * due before the target time.</p>
 *
 * <p>The clock is moved to each task's due time before the task runs, so code reading the clock
 * inside a callback sees the time it was scheduled for.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class ManualScheduler implements Scheduler {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final ManualClock clock;
    private final PriorityQueue<Task> queue = new PriorityQueue<>(
        Comparator.comparingLong((Task task) -> task.dueNanos).thenComparingLong(task -> task.sequence));
    private long nextSequence;

    /**
     * Creates a scheduler over the given clock.
     *
     * @param clock clock moved by {@link #advance(long)}
     * @throws IllegalArgumentException if clock is null
     */
    public ManualScheduler(ManualClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable task, long delayMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must not be negative (current: " + delayMs + ")");
        }
        Task scheduled = new Task(task, clock.nowNanos() + delayMs * NANOS_PER_MILLI, nextSequence++);
        queue.add(scheduled);
        return () -> cancel(scheduled);
    }

    /**
     * Moves the clock forward, running every task that falls due on the way.
     *
     * @param millis milliseconds to advance
     * @throws IllegalArgumentException if millis is negative
     */
    public void advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must not be negative (current: " + millis + ")");
        }
        long target = clock.nowNanos() + millis * NANOS_PER_MILLI;
        while (true) {
            Task next = pollDue(target);
            if (next == null) {
                break;
            }
            clock.moveTo(next.dueNanos);
            next.runnable.run();
        }
        clock.moveTo(target);
    }

    /**
     * Runs tasks already due without moving the clock.
     */
    public void runDueTasks() {
        advance(0);
    }

    /**
     * Number of scheduled tasks that have neither run nor been cancelled.
     *
     * @return pending task count
     */
    public synchronized int pendingTaskCount() {
        return queue.size();
    }

    private synchronized Task pollDue(long target) {
        Task head = queue.peek();
        if (head == null || head.dueNanos > target) {
            return null;
        }
        return queue.poll();
    }

    private synchronized boolean cancel(Task task) {
        return queue.remove(task);
    }

    private static final class Task {

        private final Runnable runnable;
        private final long dueNanos;
        private final long sequence;

        private Task(Runnable runnable, long dueNanos, long sequence) {
            this.runnable = runnable;
            this.dueNanos = dueNanos;
            this.sequence = sequence;
        }
    }
}

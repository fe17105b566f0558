package com.ryuqq.toolgate.testkit.progress;

import com.ryuqq.toolgate.core.progress.ProgressNotification;
import com.ryuqq.toolgate.core.progress.ProgressSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ProgressSink} that keeps every notification it receives.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class RecordingProgressSink implements ProgressSink {

    private final CopyOnWriteArrayList<ProgressNotification> notifications = new CopyOnWriteArrayList<>();

    @Override
    public void send(ProgressNotification notification) {
        notifications.add(notification);
    }

    /**
     * Notifications received so far, in arrival order.
     *
     * @return snapshot of received notifications
     */
    public List<ProgressNotification> notifications() {
        return List.copyOf(notifications);
    }

    public void clear() {
        notifications.clear();
    }
}

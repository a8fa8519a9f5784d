package com.meetchat.server.scheduling;

import java.time.Duration;

/**
 * A single replaceable timer. {@link #start} drops any pending run before scheduling the new one,
 * so at most one run is ever pending.
 */
public class ScheduledCancellableTask {
    private final TaskScheduler scheduler;
    private Cancellable pending;

    public ScheduledCancellableTask(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public synchronized void start(Duration delay, Runnable task) {
        cancel();
        Cancellable[] self = new Cancellable[1];
        self[0] = scheduler.schedule(() -> {
            synchronized (this) {
                if (pending != self[0]) return; // replaced or cancelled meanwhile
                pending = null;
            }
            task.run();
        }, delay);
        pending = self[0];
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    public synchronized boolean isPending() {
        return pending != null && !pending.isDone();
    }
}

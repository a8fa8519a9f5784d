package com.meetchat.client.session;

import java.time.Duration;

/**
 * Delayed task source for session timers.
 */
public interface Scheduler {

    Handle schedule(Runnable task, Duration delay);

    interface Handle {
        /** Idempotent; a no-op once the task has run. */
        void cancel();
    }
}

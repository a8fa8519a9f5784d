package com.meetchat.server.scheduling;

import java.time.Duration;

/**
 * Runs a task once after a delay. Implementations decide the thread; {@link ChatEventLoop}
 * runs tasks on the same thread that handles inbound events.
 */
public interface TaskScheduler {

    Cancellable schedule(Runnable task, Duration delay);
}

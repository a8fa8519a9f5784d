package com.meetchat.server.scheduling;

/**
 * Handle to a scheduled run. Cancelling twice, or after the run, does nothing.
 */
public interface Cancellable {

    void cancel();

    boolean isDone();
}

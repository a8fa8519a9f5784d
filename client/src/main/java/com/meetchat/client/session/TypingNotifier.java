package com.meetchat.client.session;

import java.time.Duration;

/**
 * Emits a start on every keystroke and a single stop once the user has been quiet for
 * {@code stopDelay}. Each keystroke pushes the pending stop back.
 *
 * <p>Not thread-safe: the owner must serialize calls and run the scheduled stop under the same lock.</p>
 */
public class TypingNotifier {

    public interface Emitter {
        void typingStart();

        void typingStop();
    }

    private final Scheduler scheduler;
    private final Duration stopDelay;
    private final Emitter emitter;
    private Scheduler.Handle pendingStop;

    public TypingNotifier(Scheduler scheduler, Duration stopDelay, Emitter emitter) {
        this.scheduler = scheduler;
        this.stopDelay = stopDelay;
        this.emitter = emitter;
    }

    public void keystroke() {
        emitter.typingStart();
        if (pendingStop != null) pendingStop.cancel();
        pendingStop = scheduler.schedule(this::fireStop, stopDelay);
    }

    /** Sends the stop now if one is pending (message sent, input cleared). */
    public void stopNow() {
        if (pendingStop == null) return;
        pendingStop.cancel();
        pendingStop = null;
        emitter.typingStop();
    }

    /** Drops the pending stop without emitting it. */
    public void cancel() {
        if (pendingStop != null) pendingStop.cancel();
        pendingStop = null;
    }

    public boolean isActive() {
        return pendingStop != null;
    }

    private void fireStop() {
        if (pendingStop == null) return;
        pendingStop = null;
        emitter.typingStop();
    }
}

package com.meetchat.server.dedup;

import java.time.Duration;

/**
 * Suppresses repeats of the same (meeting, user, kind) event inside a time window.
 */
public interface DedupGuard {

    /**
     * Returns {@code true} when the same key was recorded less than {@code window} ago. A suppressed
     * call does not refresh the recorded time; a passing call records now.
     */
    boolean shouldSuppress(String meetingId, String userId, String eventKind, Duration window);
}

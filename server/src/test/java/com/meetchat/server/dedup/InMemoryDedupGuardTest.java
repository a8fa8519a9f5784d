package com.meetchat.server.dedup;

import com.meetchat.server.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDedupGuardTest {

    private static final Duration WINDOW = Duration.ofSeconds(10);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final InMemoryDedupGuard guard = new InMemoryDedupGuard(clock);

    @Test
    void firstEventPassesRepeatInsideWindowIsSuppressed() {
        assertFalse(guard.shouldSuppress("m1", "alice", "presence:joined", WINDOW));
        clock.advance(Duration.ofSeconds(2));
        assertTrue(guard.shouldSuppress("m1", "alice", "presence:joined", WINDOW));
    }

    @Test
    void suppressedCallDoesNotExtendWindow() {
        guard.shouldSuppress("m1", "alice", "presence:joined", WINDOW);
        clock.advance(Duration.ofSeconds(9));
        assertTrue(guard.shouldSuppress("m1", "alice", "presence:joined", WINDOW));
        clock.advance(Duration.ofSeconds(1));
        assertFalse(guard.shouldSuppress("m1", "alice", "presence:joined", WINDOW));
    }

    @Test
    void keysAreIndependent() {
        guard.shouldSuppress("m1", "alice", "presence:joined", WINDOW);

        assertFalse(guard.shouldSuppress("m1", "alice", "presence:left", WINDOW));
        assertFalse(guard.shouldSuppress("m1", "bob", "presence:joined", WINDOW));
        assertFalse(guard.shouldSuppress("m2", "alice", "presence:joined", WINDOW));
    }

    @Test
    void staleEntriesAreSweptEventually() {
        guard.shouldSuppress("m1", "alice", "presence:joined", WINDOW);
        clock.advance(Duration.ofMinutes(1));
        for (int i = 0; i < InMemoryDedupGuard.SWEEP_EVERY; i++) {
            guard.shouldSuppress("m1", "user" + i, "presence:joined", WINDOW);
        }
        assertTrue(guard.size() <= InMemoryDedupGuard.SWEEP_EVERY);
    }
}

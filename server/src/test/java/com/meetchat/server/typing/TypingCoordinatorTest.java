package com.meetchat.server.typing;

import com.meetchat.server.support.ManualTaskScheduler;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypingCoordinatorTest {

    private final ManualTaskScheduler scheduler = new ManualTaskScheduler();
    private final List<String> events = new ArrayList<>();
    private final TypingCoordinator typing = new TypingCoordinator(scheduler, Duration.ofMillis(3000),
            new TypingListener() {
                @Override
                public void onTypingStarted(String meetingId, String userId, String userName) {
                    events.add("start:" + meetingId + ":" + userId + "@" + scheduler.nowMillis());
                }

                @Override
                public void onTypingStopped(String meetingId, String userId, String userName) {
                    events.add("stop:" + meetingId + ":" + userId + "@" + scheduler.nowMillis());
                }
            });

    @Test
    void expiresExactlyAtIdleTimeout() {
        typing.typingStart("m1", "alice", "Alice");

        scheduler.advanceMillis(2999);
        assertEquals(List.of("start:m1:alice@0"), events);
        assertTrue(typing.isTyping("m1", "alice"));

        scheduler.advanceMillis(1);
        assertEquals(List.of("start:m1:alice@0", "stop:m1:alice@3000"), events);
        assertFalse(typing.isTyping("m1", "alice"));

        scheduler.advanceMillis(10_000);
        assertEquals(2, events.size());
    }

    @Test
    void repeatedStartDebouncesAndNotifiesOnce() {
        assertTrue(typing.typingStart("m1", "alice", "Alice"));
        scheduler.advanceMillis(2000);
        assertFalse(typing.typingStart("m1", "alice", "Alice"));
        scheduler.advanceMillis(2000);

        assertEquals(List.of("start:m1:alice@0"), events);

        scheduler.advanceMillis(1000);
        assertEquals(List.of("start:m1:alice@0", "stop:m1:alice@5000"), events);
    }

    @Test
    void explicitStopCancelsTimer() {
        typing.typingStart("m1", "alice", "Alice");
        scheduler.advanceMillis(500);

        assertTrue(typing.typingStop("m1", "alice"));
        scheduler.advanceMillis(5000);

        assertEquals(List.of("start:m1:alice@0", "stop:m1:alice@500"), events);
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void stopForIdleUserIsNoOp() {
        assertFalse(typing.typingStop("m1", "alice"));
        assertTrue(events.isEmpty());
    }

    @Test
    void clearUserStopsEveryMeeting() {
        typing.typingStart("m1", "alice", "Alice");
        typing.typingStart("m2", "alice", "Alice");
        typing.typingStart("m1", "bob", "Bob");

        List<String> cleared = typing.clearUser("alice");

        assertEquals(2, cleared.size());
        assertTrue(cleared.containsAll(List.of("m1", "m2")));
        assertEquals(List.of("bob"), typing.typingUsers("m1"));
        assertTrue(typing.typingUsers("m2").isEmpty());
    }

    @Test
    void cancelAllIsSilent() {
        typing.typingStart("m1", "alice", "Alice");
        events.clear();

        typing.cancelAll();
        scheduler.advanceMillis(5000);

        assertTrue(events.isEmpty());
        assertFalse(typing.isTyping("m1", "alice"));
    }
}

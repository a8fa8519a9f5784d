package com.meetchat.server.service;

import com.meetchat.server.config.ChatSettings;
import com.meetchat.server.dedup.InMemoryDedupGuard;
import com.meetchat.server.error.PersistenceException;
import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.model.MessageType;
import com.meetchat.server.model.ParticipantStatus;
import com.meetchat.server.protocol.JoinMeeting;
import com.meetchat.server.protocol.LeaveMeeting;
import com.meetchat.server.protocol.OutboundEvent;
import com.meetchat.server.protocol.ParticipantStatusUpdate;
import com.meetchat.server.protocol.ReactToMessage;
import com.meetchat.server.protocol.SendMessage;
import com.meetchat.server.protocol.TypingStart;
import com.meetchat.server.protocol.TypingStop;
import com.meetchat.server.store.ChatStore;
import com.meetchat.server.store.InMemoryChatStore;
import com.meetchat.server.support.ManualTaskScheduler;
import com.meetchat.server.support.MutableClock;
import com.meetchat.server.support.RecordingTransport;
import com.meetchat.server.ws.InMemoryConnectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RoomBroadcasterTest {

    private ManualTaskScheduler scheduler;
    private MutableClock clock;
    private InMemoryChatStore store;
    private InMemoryConnectionRegistry registry;
    private RecordingTransport transport;
    private RoomBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new InMemoryChatStore(clock);
        registry = new InMemoryConnectionRegistry();
        transport = new RecordingTransport();
        broadcaster = newBroadcaster(store);
    }

    private RoomBroadcaster newBroadcaster(ChatStore chatStore) {
        return new RoomBroadcaster(registry, new InMemoryDedupGuard(clock), chatStore, store, transport, scheduler,
                ChatSettings.defaults(), clock);
    }

    private void join(String conn, String userId, String name) {
        broadcaster.handle(conn, new JoinMeeting("m1", userId, name));
    }

    private void joinAliceAndBob() {
        join("cA", "alice", "Alice");
        join("cB", "bob", "Bob");
        transport.clear();
    }

    private static String errorText(OutboundEvent e) {
        return ((OutboundEvent.ErrorPayload) e.data()).message();
    }

    // ---------------------------------------------------------------- join / leave

    @Test
    void joiningTwiceAnnouncesOnceAndRecordsOneSession() {
        join("cB", "bob", "Bob");
        join("cA", "alice", "Alice");
        join("cA", "alice", "Alice");

        List<OutboundEvent> joinedSeenByBob = transport.to("cB", OutboundEvent.USER_JOINED);
        assertEquals(1, joinedSeenByBob.size());
        assertEquals(new OutboundEvent.Presence("alice", "Alice"), joinedSeenByBob.get(0).data());
        assertTrue(transport.to("cA", OutboundEvent.USER_JOINED).isEmpty());
        assertEquals(2, store.listChatSessions("m1").size());
    }

    @Test
    void reconnectFromNewSocketIsSilentButReceivesFanOut() {
        joinAliceAndBob();

        join("cA2", "alice", "Alice");
        assertTrue(transport.all(OutboundEvent.USER_JOINED).isEmpty());

        broadcaster.handle("cB", new SendMessage("m1", "still there?", "bob", "Bob", null));
        assertEquals(1, transport.to("cA2", OutboundEvent.NEW_MESSAGE).size());
        assertTrue(transport.to("cA", OutboundEvent.NEW_MESSAGE).isEmpty());
    }

    @Test
    void joinIsRefusedForOutsidersOfKnownMeeting() {
        store.upsertMeeting("m1", "Standup", "bob", List.of("bob"));

        join("cM", "mallory", "Mallory");

        assertEquals(1, transport.to("cM", OutboundEvent.ERROR).size());
        assertTrue(registry.find("cM").isEmpty());
    }

    @Test
    void leaveMeetingAnnouncesDepartureAndClosesSession() {
        joinAliceAndBob();

        broadcaster.handle("cA", new LeaveMeeting("m1"));

        List<OutboundEvent> left = transport.to("cB", OutboundEvent.USER_LEFT);
        assertEquals(1, left.size());
        assertEquals(new OutboundEvent.Presence("alice", "Alice"), left.get(0).data());
        assertFalse(store.findChatSession("m1", "alice").orElseThrow().isOpen());
        assertTrue(registry.find("cA").isEmpty());
    }

    @Test
    void disconnectOfUnknownConnectionDoesNothing() {
        joinAliceAndBob();

        broadcaster.disconnect("ghost");

        assertTrue(transport.all(OutboundEvent.USER_LEFT).isEmpty());
    }

    @Test
    void switchingMeetingsLeavesThePreviousRoom() {
        joinAliceAndBob();

        broadcaster.handle("cA", new JoinMeeting("m2", "alice", "Alice"));

        assertEquals(1, transport.to("cB", OutboundEvent.USER_LEFT).size());
        assertEquals("m2", registry.find("cA").orElseThrow().meetingId());
    }

    // ---------------------------------------------------------------- messages

    @Test
    void helloTeamReachesEveryoneExactlyOnce() {
        joinAliceAndBob();

        broadcaster.handle("cA", new SendMessage("m1", "hello team", "alice", "Alice", null));

        List<OutboundEvent> atBob = transport.to("cB", OutboundEvent.NEW_MESSAGE);
        assertEquals(1, atBob.size());
        ChatMessage m = (ChatMessage) atBob.get(0).data();
        assertEquals("hello team", m.message);
        assertEquals("alice", m.senderId);
        assertEquals(MessageType.USER, m.messageType);
        assertNotNull(m.id);
        assertNotNull(m.timestamp);

        List<OutboundEvent> echo = transport.to("cA", OutboundEvent.NEW_MESSAGE);
        assertEquals(1, echo.size());
        assertEquals(m.id, ((ChatMessage) echo.get(0).data()).id);
        assertEquals(1, store.countMessages("m1"));
    }

    @Test
    void sendingWithoutJoiningIsRejected() {
        joinAliceAndBob();

        broadcaster.handle("cX", new SendMessage("m1", "hi", "carol", "Carol", null));

        assertEquals(1, transport.to("cX", OutboundEvent.ERROR).size());
        assertEquals(0, store.countMessages("m1"));
    }

    @Test
    void spoofedSenderIsRejected() {
        joinAliceAndBob();

        broadcaster.handle("cA", new SendMessage("m1", "I am bob", "bob", "Bob", null));

        assertEquals(1, transport.to("cA", OutboundEvent.ERROR).size());
        assertTrue(transport.to("cB").isEmpty());
    }

    @Test
    void blankAndOversizedTextAreRejectedBeforeStoring() {
        joinAliceAndBob();

        broadcaster.handle("cA", new SendMessage("m1", "   ", "alice", "Alice", null));
        broadcaster.handle("cA", new SendMessage("m1", "x".repeat(2001), "alice", "Alice", null));

        List<OutboundEvent> errors = transport.to("cA", OutboundEvent.ERROR);
        assertEquals(2, errors.size());
        assertEquals("Message cannot be empty", errorText(errors.get(0)));
        assertEquals(0, store.countMessages("m1"));
        assertTrue(transport.to("cB").isEmpty());
    }

    @Test
    void storeFailureNotifiesSenderOnly() {
        ChatStore failing = mock(ChatStore.class);
        when(failing.saveMessage(any())).thenThrow(new PersistenceException("down", new SQLException("gone")));
        broadcaster = newBroadcaster(failing);
        joinAliceAndBob();

        broadcaster.handle("cA", new SendMessage("m1", "hello", "alice", "Alice", null));

        List<OutboundEvent> errors = transport.to("cA", OutboundEvent.ERROR);
        assertEquals(1, errors.size());
        assertEquals("Failed to send message", errorText(errors.get(0)));
        assertTrue(transport.all(OutboundEvent.NEW_MESSAGE).isEmpty());
        assertTrue(registry.find("cA").isPresent());
    }

    @Test
    void publishFansOutStoredMessage() {
        joinAliceAndBob();
        ChatMessage saved = store.saveMessage(ChatMessage.user("m1", "alice", "Alice", null, "from REST"));

        broadcaster.publish(saved);

        assertEquals(1, transport.to("cA", OutboundEvent.NEW_MESSAGE).size());
        assertEquals(1, transport.to("cB", OutboundEvent.NEW_MESSAGE).size());
    }

    // ---------------------------------------------------------------- typing

    @Test
    void typingExpiresAfterIdleTimeoutNotBefore() {
        joinAliceAndBob();

        broadcaster.handle("cA", new TypingStart("m1", "alice", "Alice"));
        assertEquals(1, transport.to("cB", OutboundEvent.USER_TYPING).size());

        scheduler.advanceMillis(2999);
        assertTrue(transport.all(OutboundEvent.USER_STOPPED_TYPING).isEmpty());

        scheduler.advanceMillis(1);
        List<OutboundEvent> stopped = transport.to("cB", OutboundEvent.USER_STOPPED_TYPING);
        assertEquals(1, stopped.size());
        assertEquals("alice", ((OutboundEvent.Typing) stopped.get(0).data()).userId());
        assertTrue(transport.to("cA").isEmpty());

        scheduler.advanceMillis(10_000);
        assertEquals(1, transport.all(OutboundEvent.USER_STOPPED_TYPING).size());
    }

    @Test
    void repeatedKeystrokesAnnounceTypingOnce() {
        joinAliceAndBob();

        broadcaster.handle("cA", new TypingStart("m1", "alice", "Alice"));
        scheduler.advanceMillis(1000);
        broadcaster.handle("cA", new TypingStart("m1", "alice", "Alice"));
        broadcaster.handle("cA", new TypingStop("m1", "alice", "Alice"));

        assertEquals(1, transport.to("cB", OutboundEvent.USER_TYPING).size());
        assertEquals(1, transport.to("cB", OutboundEvent.USER_STOPPED_TYPING).size());
    }

    @Test
    void stopWithoutStartIsSilent() {
        joinAliceAndBob();

        broadcaster.handle("cA", new TypingStop("m1", "alice", null));

        assertTrue(transport.to("cB").isEmpty());
    }

    @Test
    void disconnectWhileTypingStopsThenLeaves() {
        joinAliceAndBob();
        broadcaster.handle("cA", new TypingStart("m1", "alice", "Alice"));
        transport.clear();

        broadcaster.disconnect("cA");

        List<String> seen = transport.to("cB").stream().map(OutboundEvent::event).collect(Collectors.toList());
        assertEquals(List.of(OutboundEvent.USER_STOPPED_TYPING, OutboundEvent.USER_LEFT), seen);
        assertEquals(0, scheduler.pendingCount());
        assertFalse(broadcaster.isTyping("m1", "alice"));
    }

    @Test
    void closeDropsTimersSilently() {
        joinAliceAndBob();
        broadcaster.handle("cA", new TypingStart("m1", "alice", "Alice"));
        transport.clear();

        broadcaster.close();
        scheduler.advanceMillis(5000);

        assertTrue(transport.all(OutboundEvent.USER_STOPPED_TYPING).isEmpty());
    }

    // ---------------------------------------------------------------- presence

    @Test
    void presenceReportedByEngineAndClientYieldsOneSystemMessage() {
        joinAliceAndBob();

        broadcaster.handle(null, new ParticipantStatusUpdate("m1", "alice", ParticipantStatus.JOINED, "Alice"));
        clock.advance(Duration.ofSeconds(2));
        broadcaster.handle("cB", new ParticipantStatusUpdate("m1", "alice", ParticipantStatus.JOINED, "Alice"));

        List<ChatMessage> persisted = store.listAllMessages("m1");
        assertEquals(1, persisted.size());
        assertEquals("Alice joined the meeting", persisted.get(0).message);
        assertEquals(ChatMessage.SYSTEM_SENDER_ID, persisted.get(0).senderId);
        assertEquals(MessageType.SYSTEM, persisted.get(0).messageType);
        assertEquals(1, transport.to("cA", OutboundEvent.NEW_MESSAGE).size());
        assertEquals(1, transport.to("cB", OutboundEvent.NEW_MESSAGE).size());
    }

    @Test
    void identicalSystemTextIsSuppressedForThirtySeconds() {
        joinAliceAndBob();
        ParticipantStatusUpdate joined = new ParticipantStatusUpdate("m1", "alice", ParticipantStatus.JOINED, "Alice");

        broadcaster.handle(null, joined);
        clock.advance(Duration.ofSeconds(12));
        broadcaster.handle(null, joined);
        assertEquals(1, store.countMessages("m1"));

        clock.advance(Duration.ofSeconds(20));
        broadcaster.handle(null, joined);
        assertEquals(2, store.countMessages("m1"));
    }

    @Test
    void leftAfterJoinedIsNotADuplicate() {
        joinAliceAndBob();

        broadcaster.handle(null, new ParticipantStatusUpdate("m1", "carol", ParticipantStatus.JOINED, null));
        broadcaster.handle(null, new ParticipantStatusUpdate("m1", "carol", ParticipantStatus.LEFT, null));

        List<String> texts = store.listAllMessages("m1").stream().map(m -> m.message).collect(Collectors.toList());
        assertEquals(List.of("carol joined the meeting", "carol left the meeting"), texts);
    }

    @Test
    void webhookFailureIsOnlyLogged() {
        ChatStore failing = mock(ChatStore.class);
        when(failing.saveMessage(any())).thenThrow(new PersistenceException("down", new SQLException("gone")));
        broadcaster = newBroadcaster(failing);
        joinAliceAndBob();

        broadcaster.handle(null, new ParticipantStatusUpdate("m1", "carol", ParticipantStatus.JOINED, "Carol"));

        assertTrue(transport.all(OutboundEvent.ERROR).isEmpty());
        assertTrue(transport.all(OutboundEvent.NEW_MESSAGE).isEmpty());
    }

    // ---------------------------------------------------------------- reactions

    @Test
    void reactionToUnknownMessageErrorsToSubmitterOnly() {
        joinAliceAndBob();

        broadcaster.handle("cA", new ReactToMessage("does-not-exist", "alice", "👍"));

        List<OutboundEvent> errors = transport.to("cA", OutboundEvent.ERROR);
        assertEquals(1, errors.size());
        assertEquals("Message not found", errorText(errors.get(0)));
        assertTrue(transport.all(OutboundEvent.MESSAGE_REACTION).isEmpty());
        assertTrue(transport.to("cB").isEmpty());
    }

    @Test
    void reactionIsBroadcastToRoom() {
        joinAliceAndBob();
        broadcaster.handle("cA", new SendMessage("m1", "ship it", "alice", "Alice", null));
        String id = ((ChatMessage) transport.to("cA", OutboundEvent.NEW_MESSAGE).get(0).data()).id;

        broadcaster.handle("cB", new ReactToMessage(id, "bob", "🎉"));

        for (String conn : List.of("cA", "cB")) {
            List<OutboundEvent> reactions = transport.to(conn, OutboundEvent.MESSAGE_REACTION);
            assertEquals(1, reactions.size());
            OutboundEvent.ReactionAdded data = (OutboundEvent.ReactionAdded) reactions.get(0).data();
            assertEquals(id, data.messageId());
            assertEquals("🎉", data.reaction().emoji());
        }
        assertEquals(1, store.listAllMessages("m1").get(0).reactions.size());
    }

    @Test
    void reactionStoreFailureUsesReactionMessage() {
        ChatStore failing = mock(ChatStore.class);
        ChatMessage target = ChatMessage.user("m1", "alice", "Alice", null, "ship it");
        target.id = "id-1";
        when(failing.findMessage("id-1")).thenReturn(Optional.of(target));
        when(failing.appendReaction(any(), any())).thenThrow(new PersistenceException("down", new SQLException()));
        broadcaster = newBroadcaster(failing);
        joinAliceAndBob();

        broadcaster.handle("cB", new ReactToMessage("id-1", "bob", "🎉"));

        assertEquals("Failed to add reaction", errorText(transport.to("cB", OutboundEvent.ERROR).get(0)));
        verify(failing).appendReaction(eq("id-1"), any());
    }

    @Test
    void reactionFromAnotherMeetingIsRefusedAndNotStored() {
        store.upsertMeeting("m1", "Private", "alice", List.of("alice"));
        join("cA", "alice", "Alice");
        broadcaster.handle("cA", new SendMessage("m1", "secret", "alice", "Alice", null));
        String secretId = ((ChatMessage) transport.to("cA", OutboundEvent.NEW_MESSAGE).get(0).data()).id;
        broadcaster.handle("cM", new JoinMeeting("m2", "mallory", "Mallory"));
        transport.clear();

        broadcaster.handle("cM", new ReactToMessage(secretId, "mallory", "😈"));

        assertEquals(1, transport.to("cM", OutboundEvent.ERROR).size());
        assertEquals("Not joined to the message's meeting", errorText(transport.to("cM", OutboundEvent.ERROR).get(0)));
        assertTrue(transport.all(OutboundEvent.MESSAGE_REACTION).isEmpty());
        assertTrue(store.findMessage(secretId).orElseThrow().reactions.isEmpty());
    }

    // ---------------------------------------------------------------- session bookkeeping

    @Test
    void chatSessionFailureRefusesJoinWithoutAnnouncingIt() {
        InMemoryChatStore flaky = spy(store);
        doThrow(new PersistenceException("down", new SQLException())).when(flaky).upsertChatSession("m1", "alice");
        broadcaster = newBroadcaster(flaky);
        join("cB", "bob", "Bob");
        transport.clear();

        join("cA", "alice", "Alice");

        assertEquals("Failed to join meeting", errorText(transport.to("cA", OutboundEvent.ERROR).get(0)));
        assertTrue(transport.all(OutboundEvent.USER_JOINED).isEmpty());
        assertTrue(registry.find("cA").isEmpty());
        assertEquals(1, registry.listConnections("m1").size());
    }
}

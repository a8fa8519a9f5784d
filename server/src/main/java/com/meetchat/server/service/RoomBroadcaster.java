package com.meetchat.server.service;

import com.meetchat.server.config.ChatSettings;
import com.meetchat.server.dedup.DedupGuard;
import com.meetchat.server.error.AuthorizationException;
import com.meetchat.server.error.ChatException;
import com.meetchat.server.error.NotFoundException;
import com.meetchat.server.error.PersistenceException;
import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.model.ConnectedUser;
import com.meetchat.server.model.Meeting;
import com.meetchat.server.model.Reaction;
import com.meetchat.server.protocol.InboundEvent;
import com.meetchat.server.protocol.InboundEventHandler;
import com.meetchat.server.protocol.JoinMeeting;
import com.meetchat.server.protocol.LeaveMeeting;
import com.meetchat.server.protocol.OutboundEvent;
import com.meetchat.server.protocol.ParticipantStatusUpdate;
import com.meetchat.server.protocol.ReactToMessage;
import com.meetchat.server.protocol.SendMessage;
import com.meetchat.server.protocol.TypingStart;
import com.meetchat.server.protocol.TypingStop;
import com.meetchat.server.scheduling.TaskScheduler;
import com.meetchat.server.store.ChatStore;
import com.meetchat.server.store.MeetingStore;
import com.meetchat.server.typing.TypingCoordinator;
import com.meetchat.server.typing.TypingListener;
import com.meetchat.server.ws.ConnectionRegistry;
import com.meetchat.server.ws.RoomTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Room orchestration: registers connections, persists through {@link ChatStore} and fans events
 * out to every connection of a meeting.
 *
 * <p>Not thread-safe. Every public method must be called from the chat event loop, which is also
 * the {@link TaskScheduler} the typing timers run on.</p>
 */
public class RoomBroadcaster implements InboundEventHandler {
    private static final Logger log = LoggerFactory.getLogger(RoomBroadcaster.class);

    private static final String PRESENCE_KIND = "presence:";

    private final ConnectionRegistry registry;
    private final DedupGuard dedup;
    private final ChatStore store;
    private final MeetingStore meetings;
    private final RoomTransport transport;
    private final ChatSettings settings;
    private final Clock clock;
    private final TypingCoordinator typing;

    public RoomBroadcaster(ConnectionRegistry registry, DedupGuard dedup, ChatStore store, MeetingStore meetings,
                           RoomTransport transport, TaskScheduler scheduler, ChatSettings settings, Clock clock) {
        this.registry = registry;
        this.dedup = dedup;
        this.store = store;
        this.meetings = meetings;
        this.transport = transport;
        this.settings = settings;
        this.clock = clock;
        this.typing = new TypingCoordinator(scheduler, settings.typingIdleTimeout(), new TypingFanOut());
    }

    /**
     * Runs one inbound event. Chat errors go back to the originating connection only; events
     * without a connection (webhook) just log them.
     */
    public void handle(String connectionId, InboundEvent event) {
        try {
            event.dispatch(connectionId, this);
        } catch (ChatException e) {
            log.warn("[REJECT] conn={} event={} kind={} {}", connectionId, event.eventName(), e.kind(), e.getMessage());
            if (connectionId != null) {
                transport.send(connectionId, OutboundEvent.error(e.getMessage()));
            }
        }
    }

    // ---------------------------------------------------------------- presence

    @Override
    public void onJoinMeeting(String connectionId, JoinMeeting e) {
        Optional<Meeting> meeting = meetings.findMeeting(e.meetingId());
        if (meeting.isPresent() && !meeting.get().admits(e.userId())) {
            throw new AuthorizationException("Not a participant of this meeting");
        }

        // one meeting per connection: switching rooms leaves the previous one
        registry.find(connectionId)
                .filter(u -> !u.meetingId().equals(e.meetingId()))
                .ifPresent(u -> depart(connectionId, false));

        String userName = displayName(e.userName(), e.userId());
        Optional<ConnectedUser> joined = registry.join(connectionId, e.meetingId(), e.userId(), userName);
        if (joined.isEmpty()) {
            log.debug("[JOIN] meeting={} user={} already registered", e.meetingId(), e.userId());
            return;
        }

        try {
            store.upsertChatSession(e.meetingId(), e.userId());
        } catch (PersistenceException ex) {
            // undo the registration so the room never sees a member it was not told about
            registry.leave(connectionId);
            log.error("[JOIN] chat session not recorded meeting={} user={}", e.meetingId(), e.userId(), ex);
            throw new PersistenceException("Failed to join meeting", ex);
        }
        try {
            store.deleteDuplicateSystemMessages(e.meetingId());
        } catch (PersistenceException ex) {
            log.warn("[JOIN] duplicate cleanup failed meeting={}: {}", e.meetingId(), ex.getMessage());
        }

        log.info("[JOIN] meeting={} user={} conn={} online={}", e.meetingId(), e.userId(), connectionId,
                registry.listConnections(e.meetingId()).size());
        sendToOthers(e.meetingId(), connectionId, OutboundEvent.userJoined(e.userId(), userName));
    }

    @Override
    public void onLeaveMeeting(String connectionId, LeaveMeeting e) {
        Optional<ConnectedUser> user = registry.find(connectionId).filter(u -> u.meetingId().equals(e.meetingId()));
        if (user.isEmpty()) {
            log.debug("[LEAVE] conn={} not in meeting={}", connectionId, e.meetingId());
            return;
        }
        depart(connectionId, false);
    }

    /** The socket is gone: drop the registration, typing state and announce the departure. */
    public void disconnect(String connectionId) {
        depart(connectionId, true);
    }

    private void depart(String connectionId, boolean socketClosed) {
        Optional<ConnectedUser> left = registry.leave(connectionId);
        if (left.isEmpty()) return;
        ConnectedUser u = left.get();

        try {
            store.closeChatSession(u.meetingId(), u.userId());
        } catch (PersistenceException ex) {
            log.error("[LEAVE] chat session not closed meeting={} user={}", u.meetingId(), u.userId(), ex);
        }

        if (socketClosed) {
            typing.clearUser(u.userId());
        } else {
            typing.typingStop(u.meetingId(), u.userId());
        }

        log.info("[LEAVE] meeting={} user={} conn={} remaining={}", u.meetingId(), u.userId(), connectionId,
                registry.listConnections(u.meetingId()).size());
        sendToRoom(u.meetingId(), OutboundEvent.userLeft(u.userId(), u.userName()));
    }

    @Override
    public void onParticipantStatusUpdate(String connectionId, ParticipantStatusUpdate e) {
        if (connectionId != null) {
            requireJoined(connectionId, e.meetingId());
        }
        String kind = PRESENCE_KIND + e.status().wire();
        if (dedup.shouldSuppress(e.meetingId(), e.userId(), kind, settings.presenceDedupWindow())) {
            log.info("[PRESENCE] duplicate {} for user={} meeting={} suppressed", e.status().wire(), e.userId(),
                    e.meetingId());
            return;
        }

        String text = e.status().announce(displayName(e.userName(), e.userId()));
        Optional<ChatMessage> recent;
        try {
            recent = store.findRecentSystemMessage(e.meetingId(), text, ChatMessage.SYSTEM_SENDER_ID,
                    settings.systemMessageDedupWindow());
        } catch (PersistenceException ex) {
            log.error("[PRESENCE] system message lookup failed meeting={}", e.meetingId(), ex);
            throw new PersistenceException("Failed to record participant status", ex);
        }
        if (recent.isPresent()) {
            log.info("[PRESENCE] '{}' already posted at {}, skipped", text, recent.get().timestamp);
            return;
        }

        ChatMessage saved = save(ChatMessage.system(e.meetingId(), text), "Failed to record participant status");
        sendToRoom(e.meetingId(), OutboundEvent.newMessage(saved));
    }

    // ---------------------------------------------------------------- messages

    @Override
    public void onSendMessage(String connectionId, SendMessage e) {
        ConnectedUser u = requireJoined(connectionId, e.meetingId());
        requireSelf(u, e.senderId());

        String text = MessageText.normalize(e.message(), settings.maxMessageLength());
        String senderName = displayName(e.senderName(), u.userName());
        ChatMessage saved = save(ChatMessage.user(e.meetingId(), e.senderId(), senderName, e.senderAvatar(), text),
                "Failed to send message");
        publish(saved);
    }

    /** Fans a stored message out to its meeting, sender included. */
    public void publish(ChatMessage saved) {
        int n = sendToRoom(saved.meetingId, OutboundEvent.newMessage(saved));
        log.debug("[BROADCAST] meeting={} id={} delivered={}", saved.meetingId, saved.id, n);
    }

    @Override
    public void onReactToMessage(String connectionId, ReactToMessage e) {
        ConnectedUser u = registry.find(connectionId)
                .orElseThrow(() -> new AuthorizationException("Join a meeting before reacting"));
        requireSelf(u, e.userId());

        ChatMessage target;
        try {
            target = store.findMessage(e.messageId())
                    .orElseThrow(() -> new NotFoundException("Message not found"));
        } catch (PersistenceException ex) {
            log.error("[REACT] lookup failure message={}", e.messageId(), ex);
            throw new PersistenceException("Failed to add reaction", ex);
        }
        // messages never move between meetings, so the check holds until the append below
        if (!target.meetingId.equals(u.meetingId())) {
            throw new AuthorizationException("Not joined to the message's meeting");
        }

        Reaction reaction = new Reaction(e.userId(), e.emoji(), clock.instant());
        ChatMessage updated;
        try {
            updated = store.appendReaction(e.messageId(), reaction);
        } catch (PersistenceException ex) {
            log.error("[REACT] store failure message={}", e.messageId(), ex);
            throw new PersistenceException("Failed to add reaction", ex);
        }
        sendToRoom(updated.meetingId, OutboundEvent.messageReaction(updated.id, reaction));
    }

    // ---------------------------------------------------------------- typing

    @Override
    public void onTypingStart(String connectionId, TypingStart e) {
        ConnectedUser u = requireJoined(connectionId, e.meetingId());
        requireSelf(u, e.userId());
        typing.typingStart(e.meetingId(), e.userId(), displayName(e.userName(), u.userName()));
    }

    @Override
    public void onTypingStop(String connectionId, TypingStop e) {
        ConnectedUser u = requireJoined(connectionId, e.meetingId());
        requireSelf(u, e.userId());
        typing.typingStop(e.meetingId(), e.userId());
    }

    public boolean isTyping(String meetingId, String userId) {
        return typing.isTyping(meetingId, userId);
    }

    /** Drops pending typing timers; called once at shutdown. */
    public void close() {
        typing.cancelAll();
    }

    // ---------------------------------------------------------------- helpers

    private ChatMessage save(ChatMessage draft, String failure) {
        try {
            return store.saveMessage(draft);
        } catch (PersistenceException ex) {
            log.error("[STORE] save failed meeting={} sender={}", draft.meetingId, draft.senderId, ex);
            throw new PersistenceException(failure, ex);
        }
    }

    private ConnectedUser requireJoined(String connectionId, String meetingId) {
        return registry.find(connectionId)
                .filter(u -> u.meetingId().equals(meetingId))
                .orElseThrow(() -> new AuthorizationException("Not joined to meeting " + meetingId));
    }

    private static void requireSelf(ConnectedUser u, String claimedUserId) {
        if (!u.userId().equals(claimedUserId)) {
            throw new AuthorizationException("User id does not match this connection");
        }
    }

    private static String displayName(String name, String fallback) {
        return name == null || name.isBlank() ? fallback : name;
    }

    private int sendToRoom(String meetingId, OutboundEvent event) {
        int n = 0;
        for (ConnectedUser c : registry.listConnections(meetingId)) {
            transport.send(c.connectionId(), event);
            n++;
        }
        return n;
    }

    private void sendToOthers(String meetingId, String excludedConnectionId, OutboundEvent event) {
        for (ConnectedUser c : registry.listConnections(meetingId)) {
            if (!c.connectionId().equals(excludedConnectionId)) {
                transport.send(c.connectionId(), event);
            }
        }
    }

    private final class TypingFanOut implements TypingListener {

        @Override
        public void onTypingStarted(String meetingId, String userId, String userName) {
            sendToOtherUsers(meetingId, userId, OutboundEvent.userTyping(userId, userName));
        }

        @Override
        public void onTypingStopped(String meetingId, String userId, String userName) {
            sendToOtherUsers(meetingId, userId, OutboundEvent.userStoppedTyping(userId, userName));
        }

        private void sendToOtherUsers(String meetingId, String userId, OutboundEvent event) {
            for (ConnectedUser c : registry.listConnections(meetingId)) {
                if (!c.userId().equals(userId)) {
                    transport.send(c.connectionId(), event);
                }
            }
        }
    }
}

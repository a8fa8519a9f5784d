package com.meetchat.server.store;

import com.meetchat.server.error.NotFoundException;
import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.model.ChatSession;
import com.meetchat.server.model.Meeting;
import com.meetchat.server.model.MessageType;
import com.meetchat.server.model.Reaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Single-process store used when no database is configured. All methods are synchronized on the
 * store; returned objects are copies.
 */
public class InMemoryChatStore implements ChatStore, MeetingStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryChatStore.class);

    private final Clock clock;

    // meetingId -> messages in insertion (= timestamp) order
    private final Map<String, List<ChatMessage>> messagesByMeeting = new HashMap<>();
    private final Map<String, ChatMessage> messagesById = new HashMap<>();
    private final Map<String, Map<String, ChatSession>> sessions = new HashMap<>();
    private final Map<String, Meeting> meetings = new LinkedHashMap<>();

    public InMemoryChatStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ChatMessage saveMessage(ChatMessage message) {
        List<ChatMessage> list = messagesByMeeting.computeIfAbsent(message.meetingId, k -> new ArrayList<>());
        Instant now = clock.instant();
        if (!list.isEmpty()) {
            Instant last = list.get(list.size() - 1).timestamp;
            if (now.isBefore(last)) now = last; // wall clock stepped back
        }
        ChatMessage stored = message.copy();
        stored.id = UUID.randomUUID().toString();
        stored.timestamp = now;
        list.add(stored);
        messagesById.put(stored.id, stored);
        return stored.copy();
    }

    @Override
    public synchronized Optional<ChatMessage> findMessage(String messageId) {
        ChatMessage m = messagesById.get(messageId);
        return m == null ? Optional.empty() : Optional.of(m.copy());
    }

    @Override
    public synchronized ChatMessage appendReaction(String messageId, Reaction reaction) {
        ChatMessage m = messagesById.get(messageId);
        if (m == null) throw new NotFoundException("Message not found");
        m.reactions.add(reaction);
        return m.copy();
    }

    @Override
    public synchronized void upsertChatSession(String meetingId, String userId) {
        Map<String, ChatSession> byUser = sessions.computeIfAbsent(meetingId, k -> new LinkedHashMap<>());
        ChatSession existing = byUser.get(userId);
        if (existing == null) {
            byUser.put(userId, new ChatSession(meetingId, userId, clock.instant(), null));
        } else if (!existing.isOpen()) {
            byUser.put(userId, new ChatSession(meetingId, userId, existing.joinedAt(), null));
        }
    }

    @Override
    public synchronized void closeChatSession(String meetingId, String userId) {
        Map<String, ChatSession> byUser = sessions.get(meetingId);
        if (byUser == null) return;
        ChatSession existing = byUser.get(userId);
        if (existing != null) {
            byUser.put(userId, new ChatSession(meetingId, userId, existing.joinedAt(), clock.instant()));
        }
    }

    @Override
    public synchronized Optional<ChatSession> findChatSession(String meetingId, String userId) {
        return Optional.ofNullable(sessions.getOrDefault(meetingId, Map.of()).get(userId));
    }

    @Override
    public synchronized List<ChatSession> listChatSessions(String meetingId) {
        return new ArrayList<>(sessions.getOrDefault(meetingId, Map.of()).values());
    }

    @Override
    public synchronized Optional<ChatMessage> findRecentSystemMessage(String meetingId, String text,
                                                                      String senderId, Duration window) {
        Instant since = clock.instant().minus(window);
        List<ChatMessage> list = messagesByMeeting.getOrDefault(meetingId, List.of());
        for (int i = list.size() - 1; i >= 0; i--) {
            ChatMessage m = list.get(i);
            if (m.timestamp.isBefore(since)) break;
            if (m.messageType == MessageType.SYSTEM && text.equals(m.message) && senderId.equals(m.senderId)) {
                return Optional.of(m.copy());
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<ChatMessage> listMessages(String meetingId, int limit) {
        List<ChatMessage> list = messagesByMeeting.getOrDefault(meetingId, List.of());
        int from = Math.max(0, list.size() - limit);
        List<ChatMessage> out = new ArrayList<>(list.size() - from);
        for (ChatMessage m : list.subList(from, list.size())) out.add(m.copy());
        return out;
    }

    @Override
    public synchronized List<ChatMessage> listAllMessages(String meetingId) {
        return listMessages(meetingId, Integer.MAX_VALUE);
    }

    @Override
    public synchronized long countMessages(String meetingId) {
        return messagesByMeeting.getOrDefault(meetingId, List.of()).size();
    }

    @Override
    public synchronized int deleteDuplicateSystemMessages(String meetingId) {
        List<ChatMessage> list = messagesByMeeting.get(meetingId);
        if (list == null) return 0;
        Set<String> seen = new HashSet<>();
        int removed = 0;
        for (var it = list.iterator(); it.hasNext(); ) {
            ChatMessage m = it.next();
            if (m.messageType != MessageType.SYSTEM) continue;
            if (!seen.add(m.message + ":" + m.senderId)) {
                it.remove();
                messagesById.remove(m.id);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} duplicate system messages for meeting {}", removed, meetingId);
        }
        return removed;
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public synchronized Optional<Meeting> findMeeting(String meetingId) {
        Meeting m = meetings.get(meetingId);
        return m == null ? Optional.empty() : Optional.of(m.copy());
    }

    @Override
    public synchronized MeetingUpsert upsertMeeting(String meetingId, String title, String hostId,
                                                    Collection<String> participants) {
        Instant now = clock.instant();
        Meeting m = meetings.get(meetingId);
        boolean created = m == null;
        if (created) {
            m = new Meeting();
            m.meetingId = meetingId;
            m.hostId = hostId;
            m.startTime = now;
            m.createdAt = now;
            meetings.put(meetingId, m);
        }
        m.title = title;
        m.participants = new LinkedHashSet<>(participants);
        m.updatedAt = now;
        return new MeetingUpsert(m.copy(), created);
    }

    @Override
    public synchronized boolean addParticipant(String meetingId, String participantId) {
        Meeting m = meetings.get(meetingId);
        if (m == null) return false;
        m.participants.add(participantId);
        m.updatedAt = clock.instant();
        return true;
    }

    @Override
    public synchronized boolean removeParticipant(String meetingId, String participantId) {
        Meeting m = meetings.get(meetingId);
        if (m == null) return false;
        m.participants.remove(participantId);
        m.updatedAt = clock.instant();
        return true;
    }

    @Override
    public synchronized List<Meeting> listMeetingsFor(String userId, int limit) {
        return meetings.values().stream()
                .filter(m -> m.admits(userId))
                .sorted(Comparator.comparing((Meeting m) -> m.startTime).reversed())
                .limit(limit)
                .map(Meeting::copy)
                .toList();
    }
}

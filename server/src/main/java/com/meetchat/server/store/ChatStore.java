package com.meetchat.server.store;

import com.meetchat.server.error.NotFoundException;
import com.meetchat.server.error.PersistenceException;
import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.model.ChatSession;
import com.meetchat.server.model.Reaction;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for messages, reactions and chat sessions. No retries happen here; every method
 * may throw {@link PersistenceException} and the caller decides what to do with it.
 */
public interface ChatStore {

    /**
     * Stores a new message. The store assigns the id and the timestamp, keeping timestamps within a
     * meeting non-decreasing in insertion order.
     *
     * @return a copy of the stored message
     */
    ChatMessage saveMessage(ChatMessage message);

    /** The message with its reactions, if one has that id. */
    Optional<ChatMessage> findMessage(String messageId);

    /**
     * Appends a reaction to a message.
     *
     * @return the message with the reaction appended
     * @throws NotFoundException if no message has that id
     */
    ChatMessage appendReaction(String messageId, Reaction reaction);

    /** Opens the (meeting, user) session, or re-opens it if it was closed. */
    void upsertChatSession(String meetingId, String userId);

    /** Sets {@code leftAt} on the (meeting, user) session, if there is one. */
    void closeChatSession(String meetingId, String userId);

    Optional<ChatSession> findChatSession(String meetingId, String userId);

    List<ChatSession> listChatSessions(String meetingId);

    /** Latest system message with exactly this text and sender, stored within {@code window} of now. */
    Optional<ChatMessage> findRecentSystemMessage(String meetingId, String text, String senderId, Duration window);

    /** The most recent {@code limit} messages of a meeting, oldest first. */
    List<ChatMessage> listMessages(String meetingId, int limit);

    /** Every message of a meeting, oldest first. */
    List<ChatMessage> listAllMessages(String meetingId);

    long countMessages(String meetingId);

    /**
     * Keeps the oldest of each (text, sender) system message in the meeting and deletes the others.
     *
     * @return number of messages deleted
     */
    int deleteDuplicateSystemMessages(String meetingId);

    /** Cheap liveness probe for health checks. */
    boolean ping();
}

package com.meetchat.server.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.model.Reaction;

/**
 * Server-to-client envelope: {@code {"event": "...", "data": {...}}}.
 */
public record OutboundEvent(String event, Object data) {
    public static final String NEW_MESSAGE = "new_message";
    public static final String USER_JOINED = "user_joined";
    public static final String USER_LEFT = "user_left";
    public static final String USER_TYPING = "user_typing";
    public static final String USER_STOPPED_TYPING = "user_stopped_typing";
    public static final String MESSAGE_REACTION = "message_reaction";
    public static final String ERROR = "error";

    public static OutboundEvent newMessage(ChatMessage message) {
        return new OutboundEvent(NEW_MESSAGE, message);
    }

    public static OutboundEvent userJoined(String userId, String userName) {
        return new OutboundEvent(USER_JOINED, new Presence(userId, userName));
    }

    public static OutboundEvent userLeft(String userId, String userName) {
        return new OutboundEvent(USER_LEFT, new Presence(userId, userName));
    }

    public static OutboundEvent userTyping(String userId, String userName) {
        return new OutboundEvent(USER_TYPING, new Typing(userId, userName));
    }

    public static OutboundEvent userStoppedTyping(String userId, String userName) {
        return new OutboundEvent(USER_STOPPED_TYPING, new Typing(userId, userName));
    }

    public static OutboundEvent messageReaction(String messageId, Reaction reaction) {
        return new OutboundEvent(MESSAGE_REACTION, new ReactionAdded(messageId, reaction));
    }

    public static OutboundEvent error(String message) {
        return new OutboundEvent(ERROR, new ErrorPayload(message));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Presence(String userId, String userName) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Typing(String userId, String userName) {
    }

    public record ReactionAdded(String messageId, Reaction reaction) {
    }

    public record ErrorPayload(String message) {
    }
}

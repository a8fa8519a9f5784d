package com.meetchat.server.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A chat line inside a meeting, as persisted and as sent to clients in {@code new_message}.
 * Only the reaction list and the edit flags change after the message is stored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {
    public static final String SYSTEM_SENDER_ID = "system";
    public static final String SYSTEM_SENDER_NAME = "System";

    @JsonAlias("_id")
    public String id;

    public String meetingId;

    public String senderId;

    public String senderName;

    public String senderAvatar;

    public String message;

    public MessageType messageType;

    public Instant timestamp;

    @JsonProperty("isEdited")
    public boolean edited;

    public Instant editedAt;

    public List<Reaction> reactions = new ArrayList<>();

    public static ChatMessage user(String meetingId, String senderId, String senderName,
                                   String senderAvatar, String text) {
        ChatMessage m = new ChatMessage();
        m.meetingId = meetingId;
        m.senderId = senderId;
        m.senderName = senderName;
        m.senderAvatar = senderAvatar;
        m.message = text;
        m.messageType = MessageType.USER;
        return m;
    }

    public static ChatMessage system(String meetingId, String text) {
        ChatMessage m = new ChatMessage();
        m.meetingId = meetingId;
        m.senderId = SYSTEM_SENDER_ID;
        m.senderName = SYSTEM_SENDER_NAME;
        m.message = text;
        m.messageType = MessageType.SYSTEM;
        return m;
    }

    public ChatMessage copy() {
        ChatMessage m = new ChatMessage();
        m.id = id;
        m.meetingId = meetingId;
        m.senderId = senderId;
        m.senderName = senderName;
        m.senderAvatar = senderAvatar;
        m.message = message;
        m.messageType = messageType;
        m.timestamp = timestamp;
        m.edited = edited;
        m.editedAt = editedAt;
        m.reactions = new ArrayList<>(reactions);
        return m;
    }

    @Override
    public String toString() {
        return "ChatMessage{id=" + id + ", meetingId=" + meetingId + ", senderId=" + senderId
                + ", type=" + messageType + ", timestamp=" + timestamp + "}";
    }
}

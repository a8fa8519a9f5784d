package com.meetchat.client.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A line of the local timeline. Confirmed messages carry the server id; optimistic ones carry a
 * {@code tempId} and stay {@code pending} until the server echo replaces them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMessage {
    @JsonAlias("_id")
    public String id;
    public String meetingId;
    public String senderId;
    public String senderName;
    public String senderAvatar;
    public String message;
    public String messageType;
    public Instant timestamp;
    @JsonProperty("isEdited")
    public boolean edited;
    public List<Reaction> reactions = new ArrayList<>();

    @JsonIgnore public String tempId;
    @JsonIgnore public boolean pending;
    @JsonIgnore public boolean failed;

    public static ChatMessage placeholder(String tempId, String meetingId, String senderId, String senderName,
                                          String text, Instant now) {
        ChatMessage m = new ChatMessage();
        m.tempId = tempId;
        m.meetingId = meetingId;
        m.senderId = senderId;
        m.senderName = senderName;
        m.message = text;
        m.messageType = "user";
        m.timestamp = now;
        m.pending = true;
        return m;
    }

    @JsonIgnore
    public boolean isConfirmed() {
        return id != null;
    }

    @JsonIgnore
    public boolean isSystem() {
        return "system".equals(messageType);
    }

    @Override
    public String toString() {
        return "ChatMessage{id=" + id + ", tempId=" + tempId + ", sender=" + senderId
                + ", pending=" + pending + ", failed=" + failed + "}";
    }
}

package com.meetchat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SendMessage(
        @NotBlank @Pattern(regexp = Patterns.MEETING_ID) String meetingId,
        @NotBlank(message = "Message cannot be empty") String message,
        @NotBlank @Size(max = Patterns.ID_MAX) String senderId,
        @Size(max = Patterns.NAME_MAX) String senderName,
        @Size(max = 512) String senderAvatar) implements InboundEvent {
    public static final String EVENT = "send_message";

    @Override
    public String eventName() {
        return EVENT;
    }

    @Override
    public void dispatch(String connectionId, InboundEventHandler handler) {
        handler.onSendMessage(connectionId, this);
    }
}

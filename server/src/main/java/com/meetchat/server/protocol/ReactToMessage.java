package com.meetchat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReactToMessage(
        @NotBlank @Size(max = 36) String messageId,
        @NotBlank @Size(max = Patterns.ID_MAX) String userId,
        @NotBlank @Size(max = Patterns.EMOJI_MAX) String emoji) implements InboundEvent {
    public static final String EVENT = "react_to_message";

    @Override
    public String eventName() {
        return EVENT;
    }

    @Override
    public void dispatch(String connectionId, InboundEventHandler handler) {
        handler.onReactToMessage(connectionId, this);
    }
}

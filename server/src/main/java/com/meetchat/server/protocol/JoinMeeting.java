package com.meetchat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JoinMeeting(
        @NotBlank @Pattern(regexp = Patterns.MEETING_ID) String meetingId,
        @NotBlank @Size(max = Patterns.ID_MAX) String userId,
        @Size(max = Patterns.NAME_MAX) String userName) implements InboundEvent {
    public static final String EVENT = "join_meeting";

    @Override
    public String eventName() {
        return EVENT;
    }

    @Override
    public void dispatch(String connectionId, InboundEventHandler handler) {
        handler.onJoinMeeting(connectionId, this);
    }
}

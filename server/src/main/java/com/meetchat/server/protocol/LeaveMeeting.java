package com.meetchat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LeaveMeeting(
        @NotBlank @Pattern(regexp = Patterns.MEETING_ID) String meetingId) implements InboundEvent {
    public static final String EVENT = "leave_meeting";

    @Override
    public String eventName() {
        return EVENT;
    }

    @Override
    public void dispatch(String connectionId, InboundEventHandler handler) {
        handler.onLeaveMeeting(connectionId, this);
    }
}

package com.meetchat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.meetchat.server.model.ParticipantStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ParticipantStatusUpdate(
        @NotBlank @Pattern(regexp = Patterns.MEETING_ID) String meetingId,
        @NotBlank @Size(max = Patterns.ID_MAX) String userId,
        @NotNull ParticipantStatus status,
        @Size(max = Patterns.NAME_MAX) String userName) implements InboundEvent {
    public static final String EVENT = "participant_status_update";

    @Override
    public String eventName() {
        return EVENT;
    }

    @Override
    public void dispatch(String connectionId, InboundEventHandler handler) {
        handler.onParticipantStatusUpdate(connectionId, this);
    }
}

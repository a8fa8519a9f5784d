package com.meetchat.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One row per (meeting, user): opened on the first join, {@code leftAt} set when the user disconnects.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatSession(String meetingId, String userId, Instant joinedAt, Instant leftAt) {

    public boolean isOpen() {
        return leftAt == null;
    }
}

package com.meetchat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Meeting record owned by the scheduling side of the product. Chat only reads it to decide who may
 * read or write a meeting's messages.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Meeting {
    public String meetingId;
    public String title;
    public String hostId;
    public Set<String> participants = new LinkedHashSet<>();
    public String status = "active";
    public Instant startTime;
    public Instant endTime;
    public Instant createdAt;
    public Instant updatedAt;

    /** Host or listed participant. */
    public boolean admits(String userId) {
        if (userId == null) return false;
        return userId.equals(hostId) || participants.contains(userId);
    }

    @JsonIgnore
    public Meeting copy() {
        Meeting m = new Meeting();
        m.meetingId = meetingId;
        m.title = title;
        m.hostId = hostId;
        m.participants = new LinkedHashSet<>(participants);
        m.status = status;
        m.startTime = startTime;
        m.endTime = endTime;
        m.createdAt = createdAt;
        m.updatedAt = updatedAt;
        return m;
    }
}

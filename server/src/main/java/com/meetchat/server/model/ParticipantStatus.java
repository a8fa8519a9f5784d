package com.meetchat.server.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Presence status reported by the media engine or a client.
 */
public enum ParticipantStatus {
    JOINED("joined", "joined the meeting"),
    LEFT("left", "left the meeting");

    private final String wire;
    private final String phrase;

    ParticipantStatus(String wire, String phrase) {
        this.wire = wire;
        this.phrase = phrase;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** Text of the system message announcing this status for {@code displayName}. */
    public String announce(String displayName) {
        return displayName + " " + phrase;
    }

    @JsonCreator
    public static ParticipantStatus fromWire(String value) {
        for (ParticipantStatus s : values()) {
            if (s.wire.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown status: " + value);
    }
}

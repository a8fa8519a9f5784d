package com.meetchat.server.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {
    USER("user"),
    SYSTEM("system");

    private final String wire;

    MessageType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static MessageType fromWire(String value) {
        for (MessageType t : values()) {
            if (t.wire.equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown messageType: " + value);
    }
}

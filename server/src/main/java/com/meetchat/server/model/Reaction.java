package com.meetchat.server.model;

import java.time.Instant;

public record Reaction(String userId, String emoji, Instant timestamp) {
}

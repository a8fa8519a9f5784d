package com.meetchat.server.config;

import java.time.Duration;

/**
 * Tunables of the chat core, bound from {@code chat.*} properties.
 */
public record ChatSettings(
        Duration typingIdleTimeout,
        Duration presenceDedupWindow,
        Duration systemMessageDedupWindow,
        int maxMessageLength,
        int defaultHistoryLimit,
        int maxHistoryLimit) {

    public static ChatSettings defaults() {
        return new ChatSettings(Duration.ofMillis(3000), Duration.ofSeconds(10), Duration.ofSeconds(30),
                2000, 50, 100);
    }

    /** Clamps a requested history size into 1..maxHistoryLimit, falling back to the default. */
    public int historyLimit(Integer requested) {
        if (requested == null) return defaultHistoryLimit;
        return Math.max(1, Math.min(maxHistoryLimit, requested));
    }
}

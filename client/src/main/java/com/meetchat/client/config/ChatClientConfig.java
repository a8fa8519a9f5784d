package com.meetchat.client.config;

import java.time.Duration;

public record ChatClientConfig(
        String wsUrl,              // ws://localhost:8080/ws/chat
        String apiBaseUrl,         // http://localhost:8080
        String meetingId,
        String userId,
        String userName,
        int historyLimit,
        Duration requestTimeout,   // history fetch and send confirmation
        Duration reconnectInitial,
        Duration reconnectMax,
        Duration typingStopDelay   // quiet period before an explicit typing_stop
) {
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RECONNECT_INITIAL = Duration.ofMillis(500);
    public static final Duration DEFAULT_RECONNECT_MAX = Duration.ofSeconds(5);
    public static final Duration DEFAULT_TYPING_STOP_DELAY = Duration.ofMillis(1200);

    public ChatClientConfig {
        if (meetingId == null || meetingId.isBlank()) throw new IllegalArgumentException("meetingId is required");
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");
        if (userName == null || userName.isBlank()) userName = userId;
    }

    public static ChatClientConfig of(String wsUrl, String apiBaseUrl, String meetingId, String userId, String userName) {
        return new ChatClientConfig(wsUrl, apiBaseUrl, meetingId, userId, userName, 50,
                DEFAULT_REQUEST_TIMEOUT, DEFAULT_RECONNECT_INITIAL, DEFAULT_RECONNECT_MAX, DEFAULT_TYPING_STOP_DELAY);
    }

    /** {@code <meetingId> <userId> [userName] [wsUrl] [apiBaseUrl]} */
    public static ChatClientConfig fromArgs(String[] args) {
        if (args.length < 2) {
            throw new IllegalArgumentException("usage: ChatCli <meetingId> <userId> [userName] [wsUrl] [apiBaseUrl]");
        }
        String name = args.length > 2 ? args[2] : args[1];
        String ws   = args.length > 3 ? args[3] : "ws://localhost:8080/ws/chat";
        String api  = args.length > 4 ? args[4] : "http://localhost:8080";
        return of(ws, api, args[0], args[1], name);
    }
}

package com.meetchat.client.session;

public enum SessionState {
    IDLE,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    CLOSED
}

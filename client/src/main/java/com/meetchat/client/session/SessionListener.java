package com.meetchat.client.session;

import com.meetchat.client.model.ChatMessage;

import java.util.List;
import java.util.Set;

/**
 * Session callbacks. They run on the thread that caused the change, under the session lock, so
 * implementations must not block.
 */
public interface SessionListener {

    default void onStateChanged(SessionState state) {
    }

    default void onTimelineChanged(List<ChatMessage> messages) {
    }

    default void onTypingUsersChanged(Set<String> userIds) {
    }

    default void onOnlineUsersChanged(Set<String> userIds) {
    }

    default void onError(String message) {
    }
}

package com.meetchat.server.typing;

public interface TypingListener {

    void onTypingStarted(String meetingId, String userId, String userName);

    void onTypingStopped(String meetingId, String userId, String userName);
}

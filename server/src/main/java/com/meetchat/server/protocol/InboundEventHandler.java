package com.meetchat.server.protocol;

public interface InboundEventHandler {

    void onJoinMeeting(String connectionId, JoinMeeting event);

    void onLeaveMeeting(String connectionId, LeaveMeeting event);

    void onSendMessage(String connectionId, SendMessage event);

    void onTypingStart(String connectionId, TypingStart event);

    void onTypingStop(String connectionId, TypingStop event);

    void onReactToMessage(String connectionId, ReactToMessage event);

    void onParticipantStatusUpdate(String connectionId, ParticipantStatusUpdate event);
}

package com.meetchat.server.model;

public record ConnectedUser(String connectionId, String userId, String userName, String meetingId) {
}

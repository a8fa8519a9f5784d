package com.meetchat.client.http;

import com.meetchat.client.model.ChatMessage;

import java.io.IOException;
import java.util.List;

@FunctionalInterface
public interface HistorySource {

    /** Most recent {@code limit} messages of the meeting, oldest first. */
    List<ChatMessage> fetch(String meetingId, int limit) throws IOException;
}

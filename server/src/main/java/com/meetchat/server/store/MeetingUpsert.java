package com.meetchat.server.store;

import com.meetchat.server.model.Meeting;

public record MeetingUpsert(Meeting meeting, boolean created) {
}

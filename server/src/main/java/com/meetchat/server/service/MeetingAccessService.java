package com.meetchat.server.service;

import com.meetchat.server.error.AuthorizationException;
import com.meetchat.server.error.NotFoundException;
import com.meetchat.server.model.Meeting;
import com.meetchat.server.store.MeetingStore;

/**
 * Read/write access to a meeting's chat: only the host and listed participants.
 */
public class MeetingAccessService {

    private final MeetingStore meetings;

    public MeetingAccessService(MeetingStore meetings) {
        this.meetings = meetings;
    }

    /**
     * @throws NotFoundException      if the meeting is unknown
     * @throws AuthorizationException if the user is neither host nor participant
     */
    public Meeting requireMember(String meetingId, String userId) {
        Meeting meeting = meetings.findMeeting(meetingId)
                .orElseThrow(() -> new NotFoundException("Meeting not found"));
        if (!meeting.admits(userId)) {
            throw new AuthorizationException("Access denied");
        }
        return meeting;
    }
}

package com.meetchat.server.store;

import com.meetchat.server.model.Meeting;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MeetingStore {

    Optional<Meeting> findMeeting(String meetingId);

    /**
     * Creates the meeting with {@code hostId} as host, or updates title and participants of an
     * existing one. The host is never changed by an update.
     */
    MeetingUpsert upsertMeeting(String meetingId, String title, String hostId, Collection<String> participants);

    /** @return false when the meeting does not exist */
    boolean addParticipant(String meetingId, String participantId);

    /** @return false when the meeting does not exist */
    boolean removeParticipant(String meetingId, String participantId);

    /** Meetings the user hosts or participates in, newest first. */
    List<Meeting> listMeetingsFor(String userId, int limit);
}

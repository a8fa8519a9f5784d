package com.meetchat.server.http;

import com.meetchat.server.error.UnauthenticatedException;
import com.meetchat.server.error.ValidationException;
import com.meetchat.server.protocol.Patterns;

/**
 * Identity headers set by the fronting identity layer.
 */
final class CallerIdentity {
    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_NAME_HEADER = "X-User-Name";

    private CallerIdentity() {
    }

    static String require(String userIdHeader) {
        if (userIdHeader == null || userIdHeader.isBlank()) {
            throw new UnauthenticatedException("Unauthorized");
        }
        return userIdHeader.trim();
    }

    static String requireMeetingId(String meetingId) {
        if (meetingId == null || !meetingId.matches(Patterns.MEETING_ID)) {
            throw new ValidationException("Invalid meetingId");
        }
        return meetingId;
    }
}

package com.meetchat.server.ws;

import com.meetchat.server.model.ConnectedUser;

import java.util.List;
import java.util.Optional;

/**
 * Which connection belongs to which user and meeting. The in-memory implementation serves a single
 * process; a shared-cache implementation can replace it without touching the broadcaster.
 */
public interface ConnectionRegistry {

    /**
     * Registers {@code connectionId} for the (meetingId, userId) pair.
     *
     * @return the registered user, or empty when that user already holds a registration in the
     * meeting (idempotent join: no new registration, no new announcement)
     */
    Optional<ConnectedUser> join(String connectionId, String meetingId, String userId, String userName);

    /**
     * Removes the connection; drops the meeting entry once its last connection is gone.
     *
     * @return the user that was registered on it, if any
     */
    Optional<ConnectedUser> leave(String connectionId);

    Optional<ConnectedUser> find(String connectionId);

    List<ConnectedUser> listConnections(String meetingId);

    boolean isConnected(String meetingId, String userId);

    int meetingCount();
}

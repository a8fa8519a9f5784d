package com.meetchat.server.protocol;

/**
 * Closed set of client-to-server events. Each variant routes itself to the matching
 * {@link InboundEventHandler} method, so adding a variant breaks every handler until it copes.
 */
public sealed interface InboundEvent
        permits JoinMeeting, LeaveMeeting, SendMessage, TypingStart, TypingStop, ReactToMessage,
        ParticipantStatusUpdate {

    /** Wire name, as carried in the envelope's {@code event} field. */
    String eventName();

    /**
     * @param connectionId originating connection, or null for events that did not arrive over a
     *                     socket (the media-engine webhook)
     */
    void dispatch(String connectionId, InboundEventHandler handler);
}

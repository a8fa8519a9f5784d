package com.meetchat.server.ws;

import com.meetchat.server.protocol.OutboundEvent;

/**
 * Delivers an event to one connection. Delivery is best effort: a connection that is gone or
 * fails to accept the frame is skipped without an exception.
 */
public interface RoomTransport {

    void send(String connectionId, OutboundEvent event);
}

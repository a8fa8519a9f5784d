package com.meetchat.server.ws;

import com.meetchat.server.error.ChatException;
import com.meetchat.server.protocol.EventCodec;
import com.meetchat.server.protocol.InboundEvent;
import com.meetchat.server.protocol.OutboundEvent;
import com.meetchat.server.scheduling.ChatEventLoop;
import com.meetchat.server.service.RoomBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint:
 * - connection opened: the session becomes addressable through the transport
 * - text frame: parsed and validated here, then handed to the broadcaster on the event loop
 * - connection closed: the broadcaster runs the disconnect, then the session is forgotten
 */
@Component
public class ChatHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(ChatHandler.class);

    private final EventCodec codec;
    private final WebSocketRoomTransport transport;
    private final RoomBroadcaster broadcaster;
    private final ChatEventLoop loop;

    public ChatHandler(EventCodec codec, WebSocketRoomTransport transport, RoomBroadcaster broadcaster,
                       ChatEventLoop loop) {
        this.codec = codec;
        this.transport = transport;
        this.broadcaster = broadcaster;
        this.loop = loop;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        transport.register(session);
        log.info("[CONNECT] conn={} remote={} open={}", session.getId(), session.getRemoteAddress(), transport.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = session.getId();
        InboundEvent event;
        try {
            event = codec.decode(message.getPayload());
        } catch (ChatException e) {
            log.warn("[WARN] rejected frame conn={}: {}", connectionId, e.getMessage());
            transport.send(connectionId, OutboundEvent.error(e.getMessage()));
            return;
        }
        loop.execute(() -> broadcaster.handle(connectionId, event));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WARN] transport error conn={}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = session.getId();
        transport.unregister(connectionId);
        loop.execute(() -> broadcaster.disconnect(connectionId));
        log.info("[DISCONNECT] conn={} status={} open={}", connectionId, status.getCode(), transport.size());
    }
}

package com.meetchat.server.ws;

import com.meetchat.server.protocol.EventCodec;
import com.meetchat.server.protocol.OutboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open WebSocket sessions keyed by session id. Sessions are wrapped so that the event loop and
 * the handler threads can write to the same socket.
 */
public class WebSocketRoomTransport implements RoomTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketRoomTransport.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final EventCodec codec;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public WebSocketRoomTransport(EventCodec codec) {
        this.codec = codec;
    }

    public void register(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    public void unregister(String connectionId) {
        sessions.remove(connectionId);
    }

    public int size() {
        return sessions.size();
    }

    @Override
    public void send(String connectionId, OutboundEvent event) {
        WebSocketSession ws = sessions.get(connectionId);
        if (ws == null || !ws.isOpen()) {
            log.debug("[SKIP] conn={} gone, dropping {}", connectionId, event.event());
            return;
        }
        try {
            ws.sendMessage(new TextMessage(codec.encode(event)));
        } catch (IOException | IllegalStateException e) {
            log.warn("[WARN] send fail conn={} event={} {}", connectionId, event.event(), e.getMessage());
        }
    }
}

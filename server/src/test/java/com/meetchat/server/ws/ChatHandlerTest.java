package com.meetchat.server.ws;

import com.meetchat.server.protocol.EventCodec;
import com.meetchat.server.protocol.JoinMeeting;
import com.meetchat.server.scheduling.ChatEventLoop;
import com.meetchat.server.service.RoomBroadcaster;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ChatHandlerTest {
    private RoomBroadcaster broadcaster;
    private WebSocketRoomTransport transport;
    private WebSocketSession session;
    private ChatHandler handler;

    @BeforeEach
    void setUp() {
        EventCodec codec = new EventCodec(EventCodec.defaultMapper(),
                Validation.buildDefaultValidatorFactory().getValidator());
        broadcaster = mock(RoomBroadcaster.class);
        ChatEventLoop loop = mock(ChatEventLoop.class);
        doAnswer(inv -> {
            inv.<Runnable>getArgument(0).run();
            return null;
        }).when(loop).execute(any());
        transport = new WebSocketRoomTransport(codec);
        handler = new ChatHandler(codec, transport, broadcaster, loop);

        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("c1");
        when(session.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(session);
    }

    @Test

    void validFrameGoesToBroadcaster() {
        handler.handleTextMessage(session, new TextMessage(
                "{\"event\":\"join_meeting\",\"data\":{\"meetingId\":\"m1\",\"userId\":\"alice\",\"userName\":\"Alice\"}}"));

        verify(broadcaster).handle(eq("c1"), eq(new JoinMeeting("m1", "alice", "Alice")));
    }

    @Test

    void badFrameAnswersWithErrorOnlyToSender() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"event\":\"dance\",\"data\":{}}"));

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(sent.capture());
        String payload = sent.getValue().getPayload();
        assertTrue(payload.contains("\"event\":\"error\""));
        assertTrue(payload.contains("Unknown event: dance"));
        verifyNoInteractions(broadcaster);
    }

    @Test

    void closeRunsDisconnectAndForgetsSession() {
        assertEquals(1, transport.size());
        handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

        verify(broadcaster).disconnect("c1");
        assertEquals(0, transport.size());
    }
}

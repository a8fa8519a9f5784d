package com.meetchat.server.http;

import com.meetchat.server.protocol.EventCodec;
import com.meetchat.server.protocol.ParticipantStatusUpdate;
import com.meetchat.server.scheduling.ChatEventLoop;
import com.meetchat.server.service.RoomBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Participant joined/left notifications from the media engine.
 */
@RestController
@RequestMapping("/internal")
public class InternalParticipantController {
    private static final Logger log = LoggerFactory.getLogger(InternalParticipantController.class);

    private final RoomBroadcaster broadcaster;
    private final ChatEventLoop loop;
    private final EventCodec codec;

    public InternalParticipantController(RoomBroadcaster broadcaster, ChatEventLoop loop, EventCodec codec) {
        this.broadcaster = broadcaster;
        this.loop = loop;
        this.codec = codec;
    }

    @Value("${internal.token}")
    private String token;

    @PostMapping("/participants")
    public ResponseEntity<Void> participantStatus(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @RequestBody ParticipantStatusUpdate update) {

        if (auth == null || !auth.equals("Bearer " + token)) {
            return ResponseEntity.status(401).build();
        }
        codec.validate(update);

        loop.execute(() -> broadcaster.handle(null, update));
        log.info("[PRESENCE] media engine meeting={} user={} status={}", update.meetingId(), update.userId(),
                update.status().wire());
        return ResponseEntity.accepted().build(); // 202
    }
}

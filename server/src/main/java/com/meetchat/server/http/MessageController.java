package com.meetchat.server.http;

import com.meetchat.server.config.ChatSettings;
import com.meetchat.server.error.AuthorizationException;
import com.meetchat.server.error.ValidationException;
import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.model.MessageType;
import com.meetchat.server.protocol.Patterns;
import com.meetchat.server.scheduling.ChatEventLoop;
import com.meetchat.server.service.MeetingAccessService;
import com.meetchat.server.service.MessageText;
import com.meetchat.server.service.RoomBroadcaster;
import com.meetchat.server.store.ChatStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * History read and the durable out-of-band send.
 */
@RestController
@RequestMapping("/api/chat/messages")
public class MessageController {
    private static final Logger log = LoggerFactory.getLogger(MessageController.class);

    private final ChatStore store;
    private final MeetingAccessService access;
    private final ChatSettings settings;
    private final RoomBroadcaster broadcaster;
    private final ChatEventLoop loop;

    public MessageController(ChatStore store, MeetingAccessService access, ChatSettings settings,
                             RoomBroadcaster broadcaster, ChatEventLoop loop) {
        this.store = store;
        this.access = access;
        this.settings = settings;
        this.broadcaster = broadcaster;
        this.loop = loop;
    }

    @GetMapping
    public Map<String, List<ChatMessage>> history(
            @RequestHeader(value = CallerIdentity.USER_ID_HEADER, required = false) String userId,
            @RequestParam(required = false) String meetingId,
            @RequestParam(required = false) Integer limit) {
        String caller = CallerIdentity.require(userId);
        CallerIdentity.requireMeetingId(meetingId);
        access.requireMember(meetingId, caller);
        return Map.of("messages", store.listMessages(meetingId, settings.historyLimit(limit)));
    }

    @PostMapping
    public Map<String, Object> post(
            @RequestHeader(value = CallerIdentity.USER_ID_HEADER, required = false) String userId,
            @Valid @RequestBody PostMessageRequest req) {
        String caller = CallerIdentity.require(userId);
        if (!req.senderId().equals(caller)) {
            throw new AuthorizationException("Sender ID must match authenticated user");
        }
        access.requireMember(req.meetingId(), caller);

        ChatMessage draft = ChatMessage.user(req.meetingId(), req.senderId(), req.senderName().trim(),
                req.senderAvatar() == null ? null : req.senderAvatar().trim(),
                MessageText.normalize(req.message(), settings.maxMessageLength()));
        draft.messageType = parseType(req.messageType());

        ChatMessage saved = store.saveMessage(draft);
        loop.execute(() -> broadcaster.publish(saved));
        log.info("[POST] meeting={} sender={} id={}", saved.meetingId, saved.senderId, saved.id);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("id", saved.id);
        return body;
    }

    private static MessageType parseType(String raw) {
        if (raw == null) return MessageType.USER;
        try {
            return MessageType.fromWire(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid messageType");
        }
    }

    public record PostMessageRequest(
            @NotBlank @Pattern(regexp = Patterns.MEETING_ID, message = "Invalid meetingId") String meetingId,
            @NotBlank(message = "Message is required") String message,
            @NotBlank(message = "Sender ID is required") String senderId,
            @NotBlank(message = "Sender name is required") @Size(max = Patterns.NAME_MAX) String senderName,
            @Size(max = 512) String senderAvatar,
            String messageType) {
    }
}

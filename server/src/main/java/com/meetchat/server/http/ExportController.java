package com.meetchat.server.http;

import com.meetchat.server.error.ValidationException;
import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.model.Meeting;
import com.meetchat.server.service.ChatExporter;
import com.meetchat.server.service.MeetingAccessService;
import com.meetchat.server.store.ChatStore;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

@RestController
public class ExportController {

    private final ChatStore store;
    private final MeetingAccessService access;
    private final ChatExporter exporter;
    private final Clock clock;

    public ExportController(ChatStore store, MeetingAccessService access, ChatExporter exporter, Clock clock) {
        this.store = store;
        this.access = access;
        this.exporter = exporter;
        this.clock = clock;
    }

    @GetMapping("/api/chat/export")
    public ResponseEntity<?> export(
            @RequestHeader(value = CallerIdentity.USER_ID_HEADER, required = false) String userId,
            @RequestParam(required = false) String meetingId,
            @RequestParam(defaultValue = "json") String format) {
        String caller = CallerIdentity.require(userId);
        if (meetingId == null || meetingId.isBlank()) {
            throw new ValidationException("Meeting ID is required");
        }
        if (!format.equals("json") && !format.equals("csv")) {
            throw new ValidationException("Format must be json or csv");
        }
        Meeting meeting = access.requireMember(meetingId, caller);
        List<ChatMessage> messages = store.listAllMessages(meetingId);

        if (format.equals("csv")) {
            return ResponseEntity.ok()
                    .contentType(new MediaType("text", "csv"))
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"chat-export-" + meetingId + ".csv\"")
                    .body(exporter.toCsv(messages));
        }
        return ResponseEntity.ok(exporter.toDocument(meeting, messages, format, clock.instant()));
    }
}

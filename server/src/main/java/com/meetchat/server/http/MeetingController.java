package com.meetchat.server.http;

import com.meetchat.server.error.AuthorizationException;
import com.meetchat.server.model.Meeting;
import com.meetchat.server.protocol.Patterns;
import com.meetchat.server.service.MeetingAccessService;
import com.meetchat.server.store.ChatStore;
import com.meetchat.server.store.MeetingStore;
import com.meetchat.server.store.MeetingUpsert;
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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Meetings the caller belongs to, with message counts; and meeting upsert.
 */
@RestController
@RequestMapping("/api/chat/meetings")
public class MeetingController {
    private static final Logger log = LoggerFactory.getLogger(MeetingController.class);

    private static final int DEFAULT_LIMIT = 20;
    private static final int MAX_LIMIT = 100;

    private final MeetingStore meetings;
    private final ChatStore store;
    private final MeetingAccessService access;

    public MeetingController(MeetingStore meetings, ChatStore store, MeetingAccessService access) {
        this.meetings = meetings;
        this.store = store;
        this.access = access;
    }

    @GetMapping
    public Map<String, Object> list(
            @RequestHeader(value = CallerIdentity.USER_ID_HEADER, required = false) String userId,
            @RequestParam(required = false) String meetingId,
            @RequestParam(required = false) Integer limit) {
        String caller = CallerIdentity.require(userId);

        List<Map<String, Object>> views = new ArrayList<>();
        if (meetingId != null) {
            CallerIdentity.requireMeetingId(meetingId);
            views.add(view(access.requireMember(meetingId, caller), caller));
        } else {
            int n = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(MAX_LIMIT, limit));
            for (Meeting m : meetings.listMeetingsFor(caller, n)) {
                views.add(view(m, caller));
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("meetings", views);
        body.put("total", views.size());
        return body;
    }

    @PostMapping
    public Map<String, Object> upsert(
            @RequestHeader(value = CallerIdentity.USER_ID_HEADER, required = false) String userId,
            @Valid @RequestBody UpsertMeetingRequest req) {
        String caller = CallerIdentity.require(userId);

        Optional<Meeting> existing = meetings.findMeeting(req.meetingId());
        if (existing.isPresent() && !caller.equals(existing.get().hostId)) {
            throw new AuthorizationException("Only the host can update this meeting");
        }

        Set<String> participants = new LinkedHashSet<>();
        if (req.participants() != null) {
            for (String p : req.participants()) {
                if (p != null && !p.isBlank()) participants.add(p.trim());
            }
        }
        participants.add(caller);

        MeetingUpsert result = meetings.upsertMeeting(req.meetingId(), req.title().trim(), caller, participants);
        log.info("[MEETING] {} meeting={} participants={}", result.created() ? "created" : "updated",
                req.meetingId(), participants.size());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("meetingId", req.meetingId());
        body.put("created", result.created());
        body.put("updated", !result.created());
        return body;
    }

    private Map<String, Object> view(Meeting m, String caller) {
        Map<String, Object> v = new LinkedHashMap<>();
        v.put("meetingId", m.meetingId);
        v.put("title", m.title);
        v.put("hostId", m.hostId);
        v.put("participants", m.participants);
        v.put("status", m.status);
        v.put("startTime", m.startTime);
        v.put("endTime", m.endTime);
        v.put("messageCount", store.countMessages(m.meetingId));
        v.put("chatSession", store.findChatSession(m.meetingId, caller).orElse(null));
        return v;
    }

    public record UpsertMeetingRequest(
            @NotBlank @Pattern(regexp = Patterns.MEETING_ID, message = "Invalid meetingId") String meetingId,
            @NotBlank(message = "Title is required") @Size(max = 255) String title,
            List<String> participants) {
    }
}

package com.meetchat.server.http;

import com.meetchat.server.error.NotFoundException;
import com.meetchat.server.model.Meeting;
import com.meetchat.server.protocol.Patterns;
import com.meetchat.server.service.MeetingAccessService;
import com.meetchat.server.store.MeetingStore;
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
import java.util.Map;

@RestController
@RequestMapping("/api/meetings/participants")
public class ParticipantController {
    private static final Logger log = LoggerFactory.getLogger(ParticipantController.class);

    private final MeetingStore meetings;
    private final MeetingAccessService access;

    public ParticipantController(MeetingStore meetings, MeetingAccessService access) {
        this.meetings = meetings;
        this.access = access;
    }

    @GetMapping
    public Map<String, Object> list(
            @RequestHeader(value = CallerIdentity.USER_ID_HEADER, required = false) String userId,
            @RequestParam(required = false) String meetingId) {
        String caller = CallerIdentity.require(userId);
        CallerIdentity.requireMeetingId(meetingId);
        Meeting m = access.requireMember(meetingId, caller);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("meetingId", meetingId);
        body.put("participants", m.participants);
        body.put("hostId", m.hostId);
        return body;
    }

    @PostMapping
    public Map<String, Object> change(
            @RequestHeader(value = CallerIdentity.USER_ID_HEADER, required = false) String userId,
            @Valid @RequestBody ParticipantChange req) {
        String caller = CallerIdentity.require(userId);
        access.requireMember(req.meetingId(), caller);

        boolean add = req.action().equals("add");
        boolean found = add
                ? meetings.addParticipant(req.meetingId(), req.participantId())
                : meetings.removeParticipant(req.meetingId(), req.participantId());
        if (!found) {
            throw new NotFoundException("Meeting not found");
        }
        log.info("[PARTICIPANT] {} {} meeting={} by={}", req.action(), req.participantId(), req.meetingId(), caller);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Participant " + (add ? "added to" : "removed from") + " meeting");
        body.put("meetingId", req.meetingId());
        body.put("participantId", req.participantId());
        body.put("action", req.action());
        return body;
    }

    public record ParticipantChange(
            @NotBlank @Pattern(regexp = Patterns.MEETING_ID, message = "Invalid meetingId") String meetingId,
            @NotBlank @Size(max = Patterns.ID_MAX) String participantId,
            @NotBlank @Pattern(regexp = "add|remove", message = "Action must be \"add\" or \"remove\"") String action) {
    }
}

package com.meetchat.server.http;

import com.meetchat.server.model.Meeting;
import com.meetchat.server.service.MeetingAccessService;
import com.meetchat.server.store.ChatStore;
import com.meetchat.server.store.MeetingStore;
import com.meetchat.server.store.MeetingUpsert;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = MeetingController.class)
class MeetingControllerTest {
    @Autowired MockMvc mvc;
    @MockBean MeetingStore meetings;
    @MockBean ChatStore store;
    @MockBean MeetingAccessService access;

    private static Meeting meeting(String id, String host) {
        Meeting m = new Meeting();
        m.meetingId = id;
        m.title = "Standup";
        m.hostId = host;
        m.participants.add(host);
        m.startTime = Instant.parse("2024-05-01T10:00:00Z");
        return m;
    }

    @Test

    void listsCallersMeetingsWithCounts() throws Exception {
        when(meetings.listMeetingsFor("alice", 20)).thenReturn(List.of(meeting("m1", "alice")));
        when(store.countMessages("m1")).thenReturn(7L);

        mvc.perform(get("/api/chat/meetings").header("X-User-Id", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.meetings[0].meetingId").value("m1"))
            .andExpect(jsonPath("$.meetings[0].messageCount").value(7));
    }

    @Test

    void singleMeetingChecksMembership() throws Exception {
        when(access.requireMember("m1", "bob")).thenReturn(meeting("m1", "alice"));

        mvc.perform(get("/api/chat/meetings").param("meetingId", "m1").header("X-User-Id", "bob"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meetings[0].hostId").value("alice"));
        verify(meetings, never()).listMeetingsFor(any(), anyInt());
    }

    @Test

    void upsertAddsCallerToParticipants() throws Exception {
        when(meetings.findMeeting("m1")).thenReturn(Optional.empty());
        when(meetings.upsertMeeting(eq("m1"), eq("Standup"), eq("alice"), any()))
            .thenReturn(new MeetingUpsert(meeting("m1", "alice"), true));

        mvc.perform(post("/api/chat/meetings").contentType("application/json").header("X-User-Id", "alice")
                .content("{\"meetingId\":\"m1\",\"title\":\" Standup \",\"participants\":[\"bob\",\"bob\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.created").value(true))
            .andExpect(jsonPath("$.updated").value(false));
        verify(meetings).upsertMeeting(eq("m1"), eq("Standup"), eq("alice"), eq(Set.of("bob", "alice")));
    }

    @Test

    void onlyHostMayUpdate() throws Exception {
        when(meetings.findMeeting("m1")).thenReturn(Optional.of(meeting("m1", "alice")));

        mvc.perform(post("/api/chat/meetings").contentType("application/json").header("X-User-Id", "bob")
                .content("{\"meetingId\":\"m1\",\"title\":\"Hijack\"}"))
            .andExpect(status().isForbidden());
        verify(meetings, never()).upsertMeeting(any(), any(), any(), any());
    }

    @Test

    void upsertRequiresTitle() throws Exception {
        mvc.perform(post("/api/chat/meetings").contentType("application/json").header("X-User-Id", "alice")
                .content("{\"meetingId\":\"m1\",\"title\":\"  \"}"))
            .andExpect(status().isBadRequest());
    }
}

package com.meetchat.server.http;

import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.model.Meeting;
import com.meetchat.server.service.ChatExporter;
import com.meetchat.server.service.MeetingAccessService;
import com.meetchat.server.store.ChatStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ExportController.class)
class ExportControllerTest {
    @Autowired MockMvc mvc;
    @MockBean ChatStore store;
    @MockBean MeetingAccessService access;

    @TestConfiguration
    static class Beans {
        @Bean
        ChatExporter chatExporter() {
            return new ChatExporter();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @BeforeEach
    void setUp() {
        Meeting m = new Meeting();
        m.meetingId = "m1";
        m.title = "Standup";
        m.hostId = "alice";
        when(access.requireMember("m1", "alice")).thenReturn(m);

        ChatMessage msg = ChatMessage.user("m1", "alice", "Alice", null, "hello");
        msg.id = "id-1";
        msg.timestamp = Instant.parse("2024-05-01T10:00:00Z");
        when(store.listAllMessages("m1")).thenReturn(List.of(msg));
    }

    @Test

    void jsonExportByDefault() throws Exception {
        mvc.perform(get("/api/chat/export").param("meetingId", "m1").header("X-User-Id", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meeting.id").value("m1"))
            .andExpect(jsonPath("$.messages[0].message").value("hello"))
            .andExpect(jsonPath("$.exportInfo.totalMessages").value(1))
            .andExpect(jsonPath("$.exportInfo.exportedAt").value("2024-05-01T12:00:00Z"));
    }

    @Test

    void csvExportIsAttachment() throws Exception {
        mvc.perform(get("/api/chat/export").param("meetingId", "m1").param("format", "csv")
                .header("X-User-Id", "alice"))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Disposition", containsString("chat-export-m1.csv")))
            .andExpect(content().string(startsWith("Timestamp,Sender,Message,Type,Reactions\n")));
    }

    @Test

    void unknownFormatIsRejected() throws Exception {
        mvc.perform(get("/api/chat/export").param("meetingId", "m1").param("format", "xml")
                .header("X-User-Id", "alice"))
            .andExpect(status().isBadRequest());
    }
}

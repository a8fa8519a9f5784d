package com.meetchat.server.service;

import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.model.Meeting;
import com.meetchat.server.model.Reaction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a meeting transcript as a JSON document or as CSV.
 */
public class ChatExporter {

    static final String CSV_HEADER = "Timestamp,Sender,Message,Type,Reactions";

    public Map<String, Object> toDocument(Meeting meeting, List<ChatMessage> messages, String format, Instant exportedAt) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("id", meeting.meetingId);
        info.put("title", meeting.title);
        info.put("hostId", meeting.hostId);
        info.put("participants", new ArrayList<>(meeting.participants));
        info.put("startTime", meeting.startTime);
        info.put("endTime", meeting.endTime);
        info.put("status", meeting.status);

        List<Map<String, Object>> lines = new ArrayList<>(messages.size());
        for (ChatMessage m : messages) {
            Map<String, Object> line = new LinkedHashMap<>();
            line.put("id", m.id);
            line.put("senderId", m.senderId);
            line.put("senderName", m.senderName);
            line.put("message", m.message);
            line.put("messageType", m.messageType);
            line.put("timestamp", m.timestamp);
            line.put("isEdited", m.edited);
            line.put("reactions", m.reactions);
            lines.add(line);
        }

        Map<String, Object> exportInfo = new LinkedHashMap<>();
        exportInfo.put("exportedAt", exportedAt);
        exportInfo.put("totalMessages", messages.size());
        exportInfo.put("format", format);

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("meeting", info);
        doc.put("messages", lines);
        doc.put("exportInfo", exportInfo);
        return doc;
    }

    public String toCsv(List<ChatMessage> messages) {
        StringBuilder sb = new StringBuilder(CSV_HEADER).append('\n');
        for (int i = 0; i < messages.size(); i++) {
            ChatMessage m = messages.get(i);
            String reactions = m.reactions.stream().map(Reaction::emoji).collect(Collectors.joining(" "));
            sb.append(quote(String.valueOf(m.timestamp))).append(',')
                    .append(quote(m.senderName)).append(',')
                    .append(quote(m.message)).append(',')
                    .append(quote(m.messageType.wire())).append(',')
                    .append(quote(reactions));
            if (i < messages.size() - 1) sb.append('\n');
        }
        return sb.toString();
    }

    private static String quote(String s) {
        String v = s == null ? "" : s;
        return "\"" + v.replace("\"", "\"\"") + "\"";
    }
}

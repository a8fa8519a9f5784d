package com.meetchat.server.store;

import com.meetchat.server.error.NotFoundException;
import com.meetchat.server.error.PersistenceException;
import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.model.ChatSession;
import com.meetchat.server.model.Meeting;
import com.meetchat.server.model.MessageType;
import com.meetchat.server.model.Reaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * {@link ChatStore} and {@link MeetingStore} over plain JDBC. Tables: meetings,
 * meeting_participants, messages, message_reactions, chat_sessions (see db/schema-mysql.sql).
 */
public class JdbcChatStore implements ChatStore, MeetingStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcChatStore.class);

    private static final String MESSAGE_COLUMNS =
            "message_id, meeting_id, sender_id, sender_name, sender_avatar, message, " +
                    "message_type, ts, is_edited, edited_at";

    private static final String INSERT_MESSAGE =
            "INSERT INTO messages (" + MESSAGE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String LAST_TIMESTAMP =
            "SELECT MAX(ts) FROM messages WHERE meeting_id = ?";

    private static final String SELECT_MESSAGE_BY_ID =
            "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE message_id = ?";

    private static final String INSERT_REACTION =
            "INSERT INTO message_reactions (message_id, user_id, emoji, ts) VALUES (?, ?, ?, ?)";

    private static final String SELECT_RECENT_MESSAGES =
            "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE meeting_id = ? " +
                    "ORDER BY ts DESC, seq DESC LIMIT ?";

    private static final String SELECT_ALL_MESSAGES =
            "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE meeting_id = ? ORDER BY ts ASC, seq ASC";

    private static final String SELECT_RECENT_SYSTEM_MESSAGE =
            "SELECT " + MESSAGE_COLUMNS + " FROM messages " +
                    "WHERE meeting_id = ? AND message_type = 'system' AND message = ? AND sender_id = ? AND ts >= ? " +
                    "ORDER BY ts DESC, seq DESC LIMIT 1";

    private static final String SELECT_SYSTEM_MESSAGES =
            "SELECT message_id, message, sender_id FROM messages " +
                    "WHERE meeting_id = ? AND message_type = 'system' ORDER BY ts ASC, seq ASC";

    private static final String COUNT_MESSAGES =
            "SELECT COUNT(*) FROM messages WHERE meeting_id = ?";

    private static final String REOPEN_SESSION =
            "UPDATE chat_sessions SET left_at = NULL WHERE meeting_id = ? AND user_id = ?";

    private static final String INSERT_SESSION =
            "INSERT INTO chat_sessions (meeting_id, user_id, joined_at) VALUES (?, ?, ?)";

    private static final String CLOSE_SESSION =
            "UPDATE chat_sessions SET left_at = ? WHERE meeting_id = ? AND user_id = ?";

    private static final String SELECT_SESSION =
            "SELECT meeting_id, user_id, joined_at, left_at FROM chat_sessions WHERE meeting_id = ? AND user_id = ?";

    private static final String SELECT_SESSIONS =
            "SELECT meeting_id, user_id, joined_at, left_at FROM chat_sessions WHERE meeting_id = ? ORDER BY joined_at";

    private static final String MEETING_COLUMNS =
            "meeting_id, title, host_id, status, start_time, end_time, created_at, updated_at";

    private static final String SELECT_MEETING =
            "SELECT " + MEETING_COLUMNS + " FROM meetings WHERE meeting_id = ?";

    private static final String INSERT_MEETING =
            "INSERT INTO meetings (" + MEETING_COLUMNS + ") VALUES (?, ?, ?, 'active', ?, NULL, ?, ?)";

    private static final String UPDATE_MEETING =
            "UPDATE meetings SET title = ?, updated_at = ? WHERE meeting_id = ?";

    private static final String TOUCH_MEETING =
            "UPDATE meetings SET updated_at = ? WHERE meeting_id = ?";

    private static final String SELECT_PARTICIPANTS =
            "SELECT user_id FROM meeting_participants WHERE meeting_id = ? ORDER BY user_id";

    private static final String DELETE_PARTICIPANTS =
            "DELETE FROM meeting_participants WHERE meeting_id = ?";

    private static final String DELETE_PARTICIPANT =
            "DELETE FROM meeting_participants WHERE meeting_id = ? AND user_id = ?";

    private static final String INSERT_PARTICIPANT =
            "INSERT INTO meeting_participants (meeting_id, user_id) VALUES (?, ?)";

    private static final String SELECT_MEETINGS_FOR_USER =
            "SELECT " + MEETING_COLUMNS + " FROM meetings m WHERE m.host_id = ? OR EXISTS " +
                    "(SELECT 1 FROM meeting_participants p WHERE p.meeting_id = m.meeting_id AND p.user_id = ?) " +
                    "ORDER BY m.start_time DESC LIMIT ?";

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcChatStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    // ---------------------------------------------------------------- messages

    @Override
    public ChatMessage saveMessage(ChatMessage message) {
        ChatMessage stored = message.copy();
        stored.id = UUID.randomUUID().toString();
        stored.reactions = new ArrayList<>();

        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);

            Instant ts = now();
            try (PreparedStatement ps = conn.prepareStatement(LAST_TIMESTAMP)) {
                ps.setString(1, stored.meetingId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        Timestamp last = rs.getTimestamp(1);
                        if (last != null && ts.isBefore(last.toInstant())) ts = last.toInstant();
                    }
                }
            }
            stored.timestamp = ts;

            try (PreparedStatement ps = conn.prepareStatement(INSERT_MESSAGE)) {
                ps.setString(1, stored.id);
                ps.setString(2, stored.meetingId);
                ps.setString(3, stored.senderId);
                ps.setString(4, stored.senderName);
                ps.setString(5, stored.senderAvatar);
                ps.setString(6, stored.message);
                ps.setString(7, stored.messageType.wire());
                ps.setTimestamp(8, Timestamp.from(stored.timestamp));
                ps.setBoolean(9, stored.edited);
                ps.setTimestamp(10, stored.editedAt == null ? null : Timestamp.from(stored.editedAt));
                ps.executeUpdate();
            }

            conn.commit();
            return stored;
        } catch (SQLException e) {
            rollback(conn);
            throw new PersistenceException("Failed to save message", e);
        } finally {
            release(conn);
        }
    }

    @Override
    public Optional<ChatMessage> findMessage(String messageId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_MESSAGE_BY_ID)) {
            ps.setString(1, messageId);
            ChatMessage message;
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                message = readMessage(rs);
            }
            attachReactions(conn, List.of(message));
            return Optional.of(message);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load message", e);
        }
    }

    @Override
    public ChatMessage appendReaction(String messageId, Reaction reaction) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);

            ChatMessage message;
            try (PreparedStatement ps = conn.prepareStatement(SELECT_MESSAGE_BY_ID)) {
                ps.setString(1, messageId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        conn.rollback();
                        throw new NotFoundException("Message not found");
                    }
                    message = readMessage(rs);
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(INSERT_REACTION)) {
                ps.setString(1, messageId);
                ps.setString(2, reaction.userId());
                ps.setString(3, reaction.emoji());
                ps.setTimestamp(4, Timestamp.from(reaction.timestamp()));
                ps.executeUpdate();
            }

            attachReactions(conn, List.of(message));
            conn.commit();
            return message;
        } catch (SQLException e) {
            rollback(conn);
            throw new PersistenceException("Failed to add reaction", e);
        } finally {
            release(conn);
        }
    }

    @Override
    public Optional<ChatMessage> findRecentSystemMessage(String meetingId, String text, String senderId, Duration window) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_RECENT_SYSTEM_MESSAGE)) {
            ps.setString(1, meetingId);
            ps.setString(2, text);
            ps.setString(3, senderId);
            ps.setTimestamp(4, Timestamp.from(now().minus(window)));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readMessage(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to look up system message", e);
        }
    }

    @Override
    public List<ChatMessage> listMessages(String meetingId, int limit) {
        try (Connection conn = dataSource.getConnection()) {
            List<ChatMessage> out = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SELECT_RECENT_MESSAGES)) {
                ps.setString(1, meetingId);
                ps.setInt(2, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(readMessage(rs));
                }
            }
            Collections.reverse(out);
            attachReactions(conn, out);
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load messages", e);
        }
    }

    @Override
    public List<ChatMessage> listAllMessages(String meetingId) {
        try (Connection conn = dataSource.getConnection()) {
            List<ChatMessage> out = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SELECT_ALL_MESSAGES)) {
                ps.setString(1, meetingId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(readMessage(rs));
                }
            }
            attachReactions(conn, out);
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load messages", e);
        }
    }

    @Override
    public long countMessages(String meetingId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(COUNT_MESSAGES)) {
            ps.setString(1, meetingId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to count messages", e);
        }
    }

    @Override
    public int deleteDuplicateSystemMessages(String meetingId) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);

            Set<String> seen = new HashSet<>();
            List<String> duplicates = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SELECT_SYSTEM_MESSAGES)) {
                ps.setString(1, meetingId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String key = rs.getString("message") + ":" + rs.getString("sender_id");
                        if (!seen.add(key)) duplicates.add(rs.getString("message_id"));
                    }
                }
            }

            if (!duplicates.isEmpty()) {
                String in = placeholders(duplicates.size());
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM message_reactions WHERE message_id IN (" + in + ")")) {
                    bindAll(ps, duplicates);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM messages WHERE message_id IN (" + in + ")")) {
                    bindAll(ps, duplicates);
                    ps.executeUpdate();
                }
                log.info("Cleaned up {} duplicate system messages for meeting {}", duplicates.size(), meetingId);
            }

            conn.commit();
            return duplicates.size();
        } catch (SQLException e) {
            rollback(conn);
            throw new PersistenceException("Failed to clean up system messages", e);
        } finally {
            release(conn);
        }
    }

    // ---------------------------------------------------------------- chat sessions

    @Override
    public void upsertChatSession(String meetingId, String userId) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);

            int updated;
            try (PreparedStatement ps = conn.prepareStatement(REOPEN_SESSION)) {
                ps.setString(1, meetingId);
                ps.setString(2, userId);
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = conn.prepareStatement(INSERT_SESSION)) {
                    ps.setString(1, meetingId);
                    ps.setString(2, userId);
                    ps.setTimestamp(3, Timestamp.from(now()));
                    ps.executeUpdate();
                }
            }

            conn.commit();
        } catch (SQLException e) {
            rollback(conn);
            throw new PersistenceException("Failed to open chat session", e);
        } finally {
            release(conn);
        }
    }

    @Override
    public void closeChatSession(String meetingId, String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(CLOSE_SESSION)) {
            ps.setTimestamp(1, Timestamp.from(now()));
            ps.setString(2, meetingId);
            ps.setString(3, userId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to close chat session", e);
        }
    }

    @Override
    public Optional<ChatSession> findChatSession(String meetingId, String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_SESSION)) {
            ps.setString(1, meetingId);
            ps.setString(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readSession(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load chat session", e);
        }
    }

    @Override
    public List<ChatSession> listChatSessions(String meetingId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_SESSIONS)) {
            ps.setString(1, meetingId);
            List<ChatSession> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(readSession(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load chat sessions", e);
        }
    }

    // ---------------------------------------------------------------- meetings

    @Override
    public Optional<Meeting> findMeeting(String meetingId) {
        try (Connection conn = dataSource.getConnection()) {
            return Optional.ofNullable(loadMeeting(conn, meetingId));
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load meeting", e);
        }
    }

    @Override
    public MeetingUpsert upsertMeeting(String meetingId, String title, String hostId, Collection<String> participants) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);

            Instant now = now();
            boolean created = loadMeeting(conn, meetingId) == null;
            if (created) {
                try (PreparedStatement ps = conn.prepareStatement(INSERT_MEETING)) {
                    ps.setString(1, meetingId);
                    ps.setString(2, title);
                    ps.setString(3, hostId);
                    ps.setTimestamp(4, Timestamp.from(now));
                    ps.setTimestamp(5, Timestamp.from(now));
                    ps.setTimestamp(6, Timestamp.from(now));
                    ps.executeUpdate();
                }
            } else {
                try (PreparedStatement ps = conn.prepareStatement(UPDATE_MEETING)) {
                    ps.setString(1, title);
                    ps.setTimestamp(2, Timestamp.from(now));
                    ps.setString(3, meetingId);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(DELETE_PARTICIPANTS)) {
                    ps.setString(1, meetingId);
                    ps.executeUpdate();
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(INSERT_PARTICIPANT)) {
                for (String p : new LinkedHashSet<>(participants)) {
                    ps.setString(1, meetingId);
                    ps.setString(2, p);
                    ps.addBatch();
                }
                ps.executeBatch();
            }

            Meeting meeting = loadMeeting(conn, meetingId);
            conn.commit();
            log.info("Meeting {} {} by {}", meetingId, created ? "created" : "updated", hostId);
            return new MeetingUpsert(meeting, created);
        } catch (SQLException e) {
            rollback(conn);
            throw new PersistenceException("Failed to save meeting", e);
        } finally {
            release(conn);
        }
    }

    @Override
    public boolean addParticipant(String meetingId, String participantId) {
        return changeParticipant(meetingId, participantId, true);
    }

    @Override
    public boolean removeParticipant(String meetingId, String participantId) {
        return changeParticipant(meetingId, participantId, false);
    }

    @Override
    public List<Meeting> listMeetingsFor(String userId, int limit) {
        try (Connection conn = dataSource.getConnection()) {
            List<Meeting> out = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SELECT_MEETINGS_FOR_USER)) {
                ps.setString(1, userId);
                ps.setString(2, userId);
                ps.setInt(3, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(readMeeting(rs));
                }
            }
            for (Meeting m : out) m.participants = loadParticipants(conn, m.meetingId);
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list meetings", e);
        }
    }

    /**
     * Validates a pooled connection.
     */
    @Override
    public boolean ping() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.error("Database connection test failed", e);
            return false;
        }
    }

    // ---------------------------------------------------------------- helpers

    private boolean changeParticipant(String meetingId, String participantId, boolean add) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);

            Meeting meeting = loadMeeting(conn, meetingId);
            if (meeting == null) {
                conn.rollback();
                return false;
            }
            boolean present = meeting.participants.contains(participantId);
            if (add && !present) {
                try (PreparedStatement ps = conn.prepareStatement(INSERT_PARTICIPANT)) {
                    ps.setString(1, meetingId);
                    ps.setString(2, participantId);
                    ps.executeUpdate();
                }
            } else if (!add && present) {
                try (PreparedStatement ps = conn.prepareStatement(DELETE_PARTICIPANT)) {
                    ps.setString(1, meetingId);
                    ps.setString(2, participantId);
                    ps.executeUpdate();
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(TOUCH_MEETING)) {
                ps.setTimestamp(1, Timestamp.from(now()));
                ps.setString(2, meetingId);
                ps.executeUpdate();
            }

            conn.commit();
            return true;
        } catch (SQLException e) {
            rollback(conn);
            throw new PersistenceException("Failed to update participants", e);
        } finally {
            release(conn);
        }
    }

    private Meeting loadMeeting(Connection conn, String meetingId) throws SQLException {
        Meeting meeting;
        try (PreparedStatement ps = conn.prepareStatement(SELECT_MEETING)) {
            ps.setString(1, meetingId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                meeting = readMeeting(rs);
            }
        }
        meeting.participants = loadParticipants(conn, meetingId);
        return meeting;
    }

    private Set<String> loadParticipants(Connection conn, String meetingId) throws SQLException {
        Set<String> out = new LinkedHashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(SELECT_PARTICIPANTS)) {
            ps.setString(1, meetingId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getString(1));
            }
        }
        return out;
    }

    private void attachReactions(Connection conn, List<ChatMessage> messages) throws SQLException {
        if (messages.isEmpty()) return;
        Map<String, ChatMessage> byId = new LinkedHashMap<>();
        for (ChatMessage m : messages) {
            m.reactions = new ArrayList<>();
            byId.put(m.id, m);
        }
        List<String> ids = new ArrayList<>(byId.keySet());
        String sql = "SELECT message_id, user_id, emoji, ts FROM message_reactions WHERE message_id IN ("
                + placeholders(ids.size()) + ") ORDER BY id";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindAll(ps, ids);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ChatMessage m = byId.get(rs.getString("message_id"));
                    m.reactions.add(new Reaction(rs.getString("user_id"), rs.getString("emoji"),
                            rs.getTimestamp("ts").toInstant()));
                }
            }
        }
    }

    private static ChatMessage readMessage(ResultSet rs) throws SQLException {
        ChatMessage m = new ChatMessage();
        m.id = rs.getString("message_id");
        m.meetingId = rs.getString("meeting_id");
        m.senderId = rs.getString("sender_id");
        m.senderName = rs.getString("sender_name");
        m.senderAvatar = rs.getString("sender_avatar");
        m.message = rs.getString("message");
        m.messageType = MessageType.fromWire(rs.getString("message_type"));
        m.timestamp = rs.getTimestamp("ts").toInstant();
        m.edited = rs.getBoolean("is_edited");
        Timestamp editedAt = rs.getTimestamp("edited_at");
        m.editedAt = editedAt == null ? null : editedAt.toInstant();
        return m;
    }

    private static ChatSession readSession(ResultSet rs) throws SQLException {
        Timestamp leftAt = rs.getTimestamp("left_at");
        return new ChatSession(rs.getString("meeting_id"), rs.getString("user_id"),
                rs.getTimestamp("joined_at").toInstant(), leftAt == null ? null : leftAt.toInstant());
    }

    private static Meeting readMeeting(ResultSet rs) throws SQLException {
        Meeting m = new Meeting();
        m.meetingId = rs.getString("meeting_id");
        m.title = rs.getString("title");
        m.hostId = rs.getString("host_id");
        m.status = rs.getString("status");
        m.startTime = rs.getTimestamp("start_time").toInstant();
        Timestamp end = rs.getTimestamp("end_time");
        m.endTime = end == null ? null : end.toInstant();
        m.createdAt = rs.getTimestamp("created_at").toInstant();
        m.updatedAt = rs.getTimestamp("updated_at").toInstant();
        return m;
    }

    private static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    private static void bindAll(PreparedStatement ps, List<String> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) ps.setString(i + 1, values.get(i));
    }

    private static void rollback(Connection conn) {
        if (conn == null) return;
        try {
            conn.rollback();
            log.error("Transaction rolled back due to error");
        } catch (SQLException ex) {
            log.error("Failed to rollback transaction", ex);
        }
    }

    private static void release(Connection conn) {
        if (conn == null) return;
        try {
            conn.setAutoCommit(true);
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection", e);
        }
    }
}

package com.meetchat.client.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.meetchat.client.config.ChatClientConfig;
import com.meetchat.client.http.HistorySource;
import com.meetchat.client.model.ChatMessage;
import com.meetchat.client.model.Reaction;
import com.meetchat.client.util.JsonUtil;
import com.meetchat.client.ws.ChatConnection;
import com.meetchat.client.ws.ChatConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * One participant's chat session in one meeting.
 *
 * <pre>
 * IDLE -> CONNECTING -> CONNECTED <-> RECONNECTING
 *                  any -> CLOSED (only through {@link #close()})
 * </pre>
 *
 * Every time the socket opens the session re-joins the meeting and re-reads history. Sends are
 * optimistic: a pending placeholder is shown at once and later replaced by the server echo, or
 * marked failed when the socket drops or no echo arrives within the request timeout.
 */
public class ClientChatSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ClientChatSession.class);

    private final ChatClientConfig config;
    private final ChatConnector connector;
    private final HistorySource history;
    private final Executor historyExecutor;
    private final Scheduler scheduler;
    private final Clock clock;
    private final SessionListener listener;

    private final MessageTimeline timeline = new MessageTimeline();
    private final ReconnectBackoff backoff;
    private final TypingNotifier typing;
    private final Map<String, String> typingUsers = new LinkedHashMap<>();
    private final Set<String> onlineUsers = new LinkedHashSet<>();
    private final Map<String, Scheduler.Handle> sendTimeouts = new HashMap<>();

    private SessionState state = SessionState.IDLE;
    private ChatConnection connection;
    private long generation;
    private Scheduler.Handle reconnectTimer;
    private String lastError;

    public ClientChatSession(ChatClientConfig config, ChatConnector connector, HistorySource history,
                             Executor historyExecutor, Scheduler scheduler, Clock clock, SessionListener listener) {
        this.config = config;
        this.connector = connector;
        this.history = history;
        this.historyExecutor = historyExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
        this.listener = listener;
        this.backoff = new ReconnectBackoff(config.reconnectInitial(), config.reconnectMax());
        this.typing = new TypingNotifier(this::scheduleLocked, config.typingStopDelay(), new TypingEmitter());
    }

    public synchronized void connect() {
        if (state != SessionState.IDLE) {
            throw new IllegalStateException("Session already started: " + state);
        }
        moveTo(SessionState.CONNECTING);
        openSocket();
    }

    // ---------------------------------------------------------------- user actions

    /**
     * Shows the message at once and sends it.
     *
     * @return the temporary id of the placeholder
     */
    public synchronized String sendMessage(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) throw new IllegalArgumentException("Message cannot be empty");
        if (state == SessionState.CLOSED) throw new IllegalStateException("Session is closed");

        typing.stopNow();
        String tempId = "tmp-" + UUID.randomUUID();
        timeline.addPending(ChatMessage.placeholder(tempId, config.meetingId(), config.userId(), config.userName(),
                trimmed, clock.instant()));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("meetingId", config.meetingId());
        data.put("message", trimmed);
        data.put("senderId", config.userId());
        data.put("senderName", config.userName());
        if (emit("send_message", data)) {
            sendTimeouts.put(tempId, scheduler.schedule(() -> sendTimedOut(tempId), config.requestTimeout()));
        } else {
            timeline.fail(tempId);
            log.warn("[SEND] not connected, placeholder {} failed", tempId);
        }
        listener.onTimelineChanged(timeline.snapshot());
        return tempId;
    }

    /** Call on every keystroke of the compose box. */
    public synchronized void keystroke() {
        if (state == SessionState.CONNECTED) typing.keystroke();
    }

    public synchronized boolean react(String messageId, String emoji) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("messageId", messageId);
        data.put("userId", config.userId());
        data.put("emoji", emoji);
        return emit("react_to_message", data);
    }

    @Override
    public synchronized void close() {
        if (state == SessionState.CLOSED) return;
        typing.stopNow();
        if (state == SessionState.CONNECTED) {
            emit("leave_meeting", Map.of("meetingId", config.meetingId()));
        }
        if (reconnectTimer != null) reconnectTimer.cancel();
        sendTimeouts.values().forEach(Scheduler.Handle::cancel);
        sendTimeouts.clear();
        generation++;
        if (connection != null) {
            connection.close(1000, "bye");
            connection = null;
        }
        timeline.failAllPending();
        typingUsers.clear();
        onlineUsers.clear();
        moveTo(SessionState.CLOSED);
        log.info("[CLOSE] meeting={} user={}", config.meetingId(), config.userId());
    }

    // ---------------------------------------------------------------- views

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized List<ChatMessage> getMessages() {
        return timeline.snapshot();
    }

    /** userId to display name of everyone currently typing. */
    public synchronized Map<String, String> getTypingUsers() {
        return Map.copyOf(typingUsers);
    }

    public synchronized Set<String> getOnlineUsers() {
        return Set.copyOf(onlineUsers);
    }

    public synchronized String getLastError() {
        return lastError;
    }

    // ---------------------------------------------------------------- socket lifecycle

    private void openSocket() {
        long gen = ++generation;
        log.info("[CONNECT] meeting={} user={} attempt={}", config.meetingId(), config.userId(), backoff.attempts());
        connection = connector.connect(new SocketEvents(gen));
    }

    private synchronized void opened(long gen) {
        if (gen != generation) return;
        backoff.reset();
        moveTo(SessionState.CONNECTED);

        Map<String, Object> join = new LinkedHashMap<>();
        join.put("meetingId", config.meetingId());
        join.put("userId", config.userId());
        join.put("userName", config.userName());
        emit("join_meeting", join);
        onlineUsers.add(config.userId());
        listener.onOnlineUsersChanged(Set.copyOf(onlineUsers));

        historyExecutor.execute(() -> loadHistory(gen));
    }

    private void loadHistory(long gen) {
        List<ChatMessage> fetched;
        try {
            fetched = history.fetch(config.meetingId(), config.historyLimit());
        } catch (IOException e) {
            log.warn("[HISTORY] fetch failed meeting={}: {}", config.meetingId(), e.getMessage());
            synchronized (this) {
                if (gen == generation) reportError("Failed to load history: " + e.getMessage());
            }
            return;
        }
        synchronized (this) {
            if (gen != generation) return;
            timeline.mergeHistory(fetched);
            for (ChatMessage m : timeline.snapshot()) {
                if (m.isConfirmed() && m.tempId != null) cancelTimeout(m.tempId);
            }
            log.debug("[HISTORY] meeting={} merged={} timeline={}", config.meetingId(), fetched.size(), timeline.size());
            listener.onTimelineChanged(timeline.snapshot());
        }
    }

    private synchronized void dropped(long gen, String reason) {
        if (gen != generation || state == SessionState.CLOSED) return;
        generation++;
        connection = null;
        typing.cancel();
        reportError(reason);

        int failed = timeline.failAllPending();
        sendTimeouts.values().forEach(Scheduler.Handle::cancel);
        sendTimeouts.clear();
        if (failed > 0) listener.onTimelineChanged(timeline.snapshot());
        if (!typingUsers.isEmpty()) {
            typingUsers.clear();
            listener.onTypingUsersChanged(Set.of());
        }

        moveTo(SessionState.RECONNECTING);
        Duration delay = backoff.next();
        log.info("[RECONNECT] meeting={} in {}ms ({})", config.meetingId(), delay.toMillis(), reason);
        reconnectTimer = scheduler.schedule(this::reconnect, delay);
    }

    private synchronized void reconnect() {
        reconnectTimer = null;
        if (state != SessionState.RECONNECTING) return;
        openSocket();
    }

    // ---------------------------------------------------------------- inbound

    private synchronized void received(long gen, String frame) {
        if (gen != generation) return;
        JsonUtil.Envelope env;
        try {
            env = JsonUtil.parse(frame);
        } catch (IOException e) {
            log.warn("[WARN] unreadable frame: {}", e.getMessage());
            return;
        }
        try {
            dispatch(env);
        } catch (JsonProcessingException e) {
            log.warn("[WARN] bad {} payload: {}", env.event(), e.getOriginalMessage());
        }
    }

    private void dispatch(JsonUtil.Envelope env) throws JsonProcessingException {
        switch (env.event()) {
            case "new_message" -> {
                ChatMessage m = env.as(ChatMessage.class);
                if (m.id == null) return;
                Optional<ChatMessage> replaced = timeline.accept(m);
                replaced.ifPresent(p -> cancelTimeout(p.tempId));
                if (m.senderId != null && typingUsers.remove(m.senderId) != null) {
                    listener.onTypingUsersChanged(Set.copyOf(typingUsers.keySet()));
                }
                listener.onTimelineChanged(timeline.snapshot());
            }
            case "user_joined" -> {
                if (onlineUsers.add(env.text("userId"))) listener.onOnlineUsersChanged(Set.copyOf(onlineUsers));
            }
            case "user_left" -> {
                String userId = env.text("userId");
                boolean changed = onlineUsers.remove(userId);
                if (typingUsers.remove(userId) != null) listener.onTypingUsersChanged(Set.copyOf(typingUsers.keySet()));
                if (changed) listener.onOnlineUsersChanged(Set.copyOf(onlineUsers));
            }
            case "user_typing" -> {
                String userId = env.text("userId");
                if (userId == null || userId.equals(config.userId())) return;
                String name = env.text("userName");
                if (typingUsers.put(userId, name == null ? userId : name) == null) {
                    listener.onTypingUsersChanged(Set.copyOf(typingUsers.keySet()));
                }
            }
            case "user_stopped_typing" -> {
                if (typingUsers.remove(env.text("userId")) != null) {
                    listener.onTypingUsersChanged(Set.copyOf(typingUsers.keySet()));
                }
            }
            case "message_reaction" -> {
                Reaction r = env.field("reaction", Reaction.class);
                if (r != null && timeline.addReaction(env.text("messageId"), r)) {
                    listener.onTimelineChanged(timeline.snapshot());
                }
            }
            case "error" -> reportError(env.text("message"));
            default -> log.debug("[WARN] ignoring event {}", env.event());
        }
    }

    // ---------------------------------------------------------------- helpers

    private boolean emit(String event, Map<String, ?> data) {
        if (state != SessionState.CONNECTED || connection == null) return false;
        return connection.send(JsonUtil.envelope(event, data));
    }

    private synchronized void sendTimedOut(String tempId) {
        if (sendTimeouts.remove(tempId) == null) return;
        if (timeline.fail(tempId)) {
            log.warn("[SEND] no confirmation for {} within {}ms", tempId, config.requestTimeout().toMillis());
            reportError("Message was not confirmed in time");
            listener.onTimelineChanged(timeline.snapshot());
        }
    }

    private Scheduler.Handle scheduleLocked(Runnable task, Duration delay) {
        return scheduler.schedule(() -> {
            synchronized (this) {
                task.run();
            }
        }, delay);
    }

    private void cancelTimeout(String tempId) {
        Scheduler.Handle h = sendTimeouts.remove(tempId);
        if (h != null) h.cancel();
    }

    private void reportError(String message) {
        lastError = message;
        listener.onError(message);
    }

    private void moveTo(SessionState next) {
        if (state == next) return;
        log.debug("[STATE] {} -> {}", state, next);
        state = next;
        listener.onStateChanged(next);
    }

    private final class TypingEmitter implements TypingNotifier.Emitter {
        @Override public void typingStart() {
            emitTyping("typing_start");
        }

        @Override public void typingStop() {
            emitTyping("typing_stop");
        }

        private void emitTyping(String event) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("meetingId", config.meetingId());
            data.put("userId", config.userId());
            data.put("userName", config.userName());
            emit(event, data);
        }
    }

    private final class SocketEvents implements ChatConnection.Listener {
        private final long gen;

        SocketEvents(long gen) {
            this.gen = gen;
        }

        @Override public void onOpen() {
            opened(gen);
        }

        @Override public void onMessage(String frame) {
            received(gen, frame);
        }

        @Override public void onClosed(int code, String reason) {
            dropped(gen, "Connection closed (" + code + ")");
        }

        @Override public void onFailure(Throwable t) {
            dropped(gen, "Connection failed: " + t.getMessage());
        }
    }
}

package com.meetchat.server.typing;

import com.meetchat.server.scheduling.ScheduledCancellableTask;
import com.meetchat.server.scheduling.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per (meeting, user) typing state: Idle or Typing. Entering Typing notifies
 * {@link TypingListener#onTypingStarted}; leaving it, by expiry, explicit stop or disconnect,
 * notifies {@link TypingListener#onTypingStopped} exactly once.
 */
public class TypingCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TypingCoordinator.class);

    private final TaskScheduler scheduler;
    private final Duration idleTimeout;
    private final TypingListener listener;

    // meetingId -> userId -> entry
    private final Map<String, Map<String, TypingEntry>> typing = new ConcurrentHashMap<>();

    public TypingCoordinator(TaskScheduler scheduler, Duration idleTimeout, TypingListener listener) {
        this.scheduler = scheduler;
        this.idleTimeout = idleTimeout;
        this.listener = listener;
    }

    /**
     * Idle -> Typing, or restarts the idle timer when already typing.
     *
     * @return true if this call entered the Typing state
     */
    public boolean typingStart(String meetingId, String userId, String userName) {
        Map<String, TypingEntry> users = typing.computeIfAbsent(meetingId, k -> new ConcurrentHashMap<>());
        TypingEntry entry = users.get(userId);
        boolean entered = entry == null;
        if (entered) {
            entry = new TypingEntry(meetingId, userId, userName, new ScheduledCancellableTask(scheduler));
            users.put(userId, entry);
        }
        TypingEntry current = entry;
        current.expiry.start(idleTimeout, () -> expire(current));
        if (entered) {
            listener.onTypingStarted(meetingId, userId, userName);
        }
        return entered;
    }

    /**
     * Typing -> Idle. No-op for a user who is not typing.
     */
    public boolean typingStop(String meetingId, String userId) {
        TypingEntry entry = remove(meetingId, userId);
        if (entry == null) return false;
        entry.expiry.cancel();
        listener.onTypingStopped(meetingId, userId, entry.userName);
        return true;
    }

    /**
     * Forces every typing entry of {@code userId} back to Idle, across meetings.
     *
     * @return meetings in which the user was typing
     */
    public List<String> clearUser(String userId) {
        List<String> cleared = new ArrayList<>();
        for (String meetingId : new ArrayList<>(typing.keySet())) {
            if (typingStop(meetingId, userId)) cleared.add(meetingId);
        }
        return cleared;
    }

    public boolean isTyping(String meetingId, String userId) {
        Map<String, TypingEntry> users = typing.get(meetingId);
        return users != null && users.containsKey(userId);
    }

    public List<String> typingUsers(String meetingId) {
        Map<String, TypingEntry> users = typing.get(meetingId);
        return users == null ? List.of() : new ArrayList<>(users.keySet());
    }

    /**
     * Cancels all pending expiry timers without notifying anyone.
     */
    public void cancelAll() {
        int n = 0;
        for (Map<String, TypingEntry> users : typing.values()) {
            for (Iterator<TypingEntry> it = users.values().iterator(); it.hasNext(); ) {
                it.next().expiry.cancel();
                it.remove();
                n++;
            }
        }
        typing.clear();
        log.info("Cancelled {} typing timers", n);
    }

    private void expire(TypingEntry entry) {
        Map<String, TypingEntry> users = typing.get(entry.meetingId);
        if (users == null || users.get(entry.userId) != entry) return;
        remove(entry.meetingId, entry.userId);
        log.debug("[TYPING] expired meeting={} user={}", entry.meetingId, entry.userId);
        listener.onTypingStopped(entry.meetingId, entry.userId, entry.userName);
    }

    private TypingEntry remove(String meetingId, String userId) {
        Map<String, TypingEntry> users = typing.get(meetingId);
        if (users == null) return null;
        TypingEntry entry = users.remove(userId);
        if (users.isEmpty()) typing.remove(meetingId);
        return entry;
    }

    private static final class TypingEntry {
        final String meetingId;
        final String userId;
        final String userName;
        final ScheduledCancellableTask expiry;

        TypingEntry(String meetingId, String userId, String userName, ScheduledCancellableTask expiry) {
            this.meetingId = meetingId;
            this.userId = userId;
            this.userName = userName;
            this.expiry = expiry;
        }
    }
}

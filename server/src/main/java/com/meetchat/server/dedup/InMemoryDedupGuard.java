package com.meetchat.server.dedup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the last accepted time per key. Entries are never removed individually; every
 * {@value #SWEEP_EVERY} calls, entries older than the widest window seen so far are dropped.
 */
public class InMemoryDedupGuard implements DedupGuard {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDedupGuard.class);
    static final int SWEEP_EVERY = 256;

    private final Clock clock;
    private final Map<Key, Instant> lastSeen = new ConcurrentHashMap<>();
    private Duration widestWindow = Duration.ZERO;
    private int calls;

    public InMemoryDedupGuard(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean shouldSuppress(String meetingId, String userId, String eventKind, Duration window) {
        Instant now = clock.instant();
        if (window.compareTo(widestWindow) > 0) widestWindow = window;
        if (++calls % SWEEP_EVERY == 0) sweep(now);

        Key key = new Key(meetingId, userId, eventKind);
        Instant last = lastSeen.get(key);
        if (last != null && Duration.between(last, now).compareTo(window) < 0) {
            log.debug("[DEDUP] suppressed {} within {}ms", key, window.toMillis());
            return true;
        }
        lastSeen.put(key, now);
        return false;
    }

    int size() {
        return lastSeen.size();
    }

    private void sweep(Instant now) {
        Instant cutoff = now.minus(widestWindow);
        lastSeen.values().removeIf(t -> t.isBefore(cutoff));
    }

    private record Key(String meetingId, String userId, String eventKind) {
    }
}

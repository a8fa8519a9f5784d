package com.meetchat.client.session;

import java.time.Duration;

/**
 * Doubling delay between reconnect attempts, capped. Attempts are unbounded.
 */
public class ReconnectBackoff {

    private final long initialMs;
    private final long maxMs;
    private long nextMs;
    private int attempts;

    public ReconnectBackoff(Duration initial, Duration max) {
        if (initial.isNegative() || initial.isZero() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Require 0 < initial <= max");
        }
        this.initialMs = initial.toMillis();
        this.maxMs = max.toMillis();
        this.nextMs = initialMs;
    }

    public Duration next() {
        long d = nextMs;
        nextMs = Math.min(nextMs * 2, maxMs);
        attempts++;
        return Duration.ofMillis(d);
    }

    public void reset() {
        nextMs = initialMs;
        attempts = 0;
    }

    public int attempts() {
        return attempts;
    }
}

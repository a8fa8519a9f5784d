package com.meetchat.client.session;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectBackoffTest {

    @Test

    void doublesUpToCapAndKeepsGoing() {
        ReconnectBackoff b = new ReconnectBackoff(Duration.ofMillis(500), Duration.ofSeconds(5));
        long[] expected = {500, 1000, 2000, 4000, 5000, 5000, 5000};
        for (long ms : expected) {
            assertEquals(Duration.ofMillis(ms), b.next());
        }
        assertEquals(7, b.attempts());
    }

    @Test

    void resetStartsOver() {
        ReconnectBackoff b = new ReconnectBackoff(Duration.ofMillis(500), Duration.ofSeconds(5));
        b.next();
        b.next();
        b.reset();
        assertEquals(Duration.ofMillis(500), b.next());
        assertEquals(1, b.attempts());
    }

    @Test

    void rejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectBackoff(Duration.ofSeconds(5), Duration.ofMillis(500)));
    }
}

package com.insider.resolution.concurrent;

import com.insider.resolution.support.FakeNanoClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    private final FakeNanoClock clock = new FakeNanoClock();

    @Test
    @DisplayName("Should count down and expire")
    void countsDown() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(2), clock);
        assertEquals(Duration.ofSeconds(2), deadline.remaining());
        clock.advance(Duration.ofMillis(1500));
        assertEquals(Duration.ofMillis(500), deadline.remaining());
        assertFalse(deadline.isExpired());
        clock.advance(Duration.ofSeconds(1));
        assertTrue(deadline.isExpired());
        assertEquals(Duration.ZERO, deadline.remaining());
    }

    @Test
    @DisplayName("Should cap the remaining time")
    void remainingOrAtMost() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(60), clock);
        assertEquals(Duration.ofSeconds(30), deadline.remainingOrAtMost(Duration.ofSeconds(30)));
        clock.advance(Duration.ofSeconds(50));
        assertEquals(Duration.ofSeconds(10), deadline.remainingOrAtMost(Duration.ofSeconds(30)));
    }

    @Test
    @DisplayName("Should extend by a grace period")
    void extendedBy() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(1), clock);
        Deadline hard = deadline.extendedBy(Duration.ofSeconds(2));
        clock.advance(Duration.ofMillis(1500));
        assertTrue(deadline.isExpired());
        assertFalse(hard.isExpired());
        assertEquals(Duration.ofMillis(1500), hard.remaining());
    }

    @Test
    @DisplayName("Should saturate instead of wrapping for very long durations")
    void saturatesLongDurations() {
        clock.advance(Duration.ofDays(1));
        Deadline deadline = Deadline.after(Duration.ofDays(365_000), clock);
        assertFalse(deadline.isExpired());
        assertTrue(deadline.remaining().compareTo(Duration.ofDays(365_000)) <= 0);
        assertTrue(deadline.remaining().compareTo(Duration.ofDays(100_000)) > 0);

        Deadline extended = deadline.extendedBy(Duration.ofDays(365_000));
        assertFalse(extended.isExpired());
        assertEquals(Duration.ofNanos(Long.MAX_VALUE), extended.remaining());

        clock.advance(Duration.ofDays(3650));
        assertFalse(deadline.isExpired());
        assertFalse(extended.isExpired());
    }

    @Test
    @DisplayName("Should treat a negative duration as already expired")
    void negativeDuration() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(-5), clock);
        assertTrue(deadline.isExpired());
        assertEquals(Duration.ZERO, deadline.remaining());
    }
}

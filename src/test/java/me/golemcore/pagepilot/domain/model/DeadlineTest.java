package me.golemcore.pagepilot.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldReportRemainingTime() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(5), clock);

        assertEquals(Duration.ofSeconds(5), deadline.remaining());
        assertFalse(deadline.isExpired());
    }

    @Test
    void shouldClampNegativeBudgets() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(-1), clock);

        assertEquals(Duration.ZERO, deadline.remaining());
        assertTrue(deadline.isExpired());
    }

    @Test
    void shouldNeverExtendParentDeadline() {
        Deadline parent = Deadline.after(Duration.ofSeconds(10), clock);

        assertEquals(Duration.ofSeconds(3), parent.within(Duration.ofSeconds(3)).remaining());
        assertEquals(Duration.ofSeconds(10), parent.within(Duration.ofMinutes(1)).remaining());
    }
}

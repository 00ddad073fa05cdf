package me.golemcore.workbridge.ratelimit;

import me.golemcore.workbridge.domain.model.ThrottleDecision;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ThrottleWindowTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldAllowUpToMaxEventsWithinWindow() {
        ThrottleWindow window = new ThrottleWindow(Duration.ofSeconds(5), 2);

        assertTrue(window.tryAcquire(T0).isAllowed());
        assertTrue(window.tryAcquire(T0.plusMillis(100)).isAllowed());
        ThrottleDecision third = window.tryAcquire(T0.plusMillis(200));

        assertFalse(third.isAllowed());
        assertEquals(2, third.getRecentCount());
        assertEquals(4800, third.getRetryAfterMs());
    }

    @Test
    void shouldSlideWindow() {
        ThrottleWindow window = new ThrottleWindow(Duration.ofSeconds(5), 2);
        window.tryAcquire(T0);
        window.tryAcquire(T0.plusSeconds(3));

        assertFalse(window.tryAcquire(T0.plusSeconds(4)).isAllowed());
        assertTrue(window.tryAcquire(T0.plusSeconds(5)).isAllowed());
        assertFalse(window.tryAcquire(T0.plusSeconds(6)).isAllowed());
    }

    @Test
    void shouldNotRecordDroppedEvents() {
        ThrottleWindow window = new ThrottleWindow(Duration.ofSeconds(10), 1);
        window.tryAcquire(T0);
        window.tryAcquire(T0.plusSeconds(1));
        window.tryAcquire(T0.plusSeconds(2));

        assertEquals(1, window.getRecentCount(T0.plusSeconds(2)));
        assertEquals(T0, window.getLastEmission());
        assertEquals(0, window.getRecentCount(T0.plusSeconds(10)));
    }
}

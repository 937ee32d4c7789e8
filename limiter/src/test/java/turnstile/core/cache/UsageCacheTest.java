package turnstile.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.core.model.ratelimit.WindowKeyer;
import turnstile.core.model.ratelimit.WindowKind;
import turnstile.mock.MutableClock;

@DisplayName("UsageCache")
class UsageCacheTest {

    private MutableClock clock;
    private UsageCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-06-24T14:30:00Z");
        cache = new UsageCache(100, clock);
    }

    @Test
    @DisplayName("should remember usage per identity, consumer and window")
    void shouldRememberUsage() {
        var window = WindowKeyer.keyFor(WindowKind.HOURLY, clock.instant());
        cache.remember("10.0.0.1", "reports", window, 7);

        assertEquals(7L, cache.lastKnown("10.0.0.1", "reports", window).orElseThrow());
        assertTrue(cache.lastKnown("10.0.0.2", "reports", window).isEmpty());
        assertTrue(cache.lastKnown("10.0.0.1", "billing", window).isEmpty());
    }

    @Test
    @DisplayName("should forget usage at the window boundary")
    void shouldForgetAtBoundary() {
        var window = WindowKeyer.keyFor(WindowKind.HOURLY, clock.instant());
        cache.remember("10.0.0.1", "reports", window, 7);

        clock.advance(Duration.ofMinutes(30));

        assertTrue(cache.lastKnown("10.0.0.1", "reports", window).isEmpty());
        var next = WindowKeyer.keyFor(WindowKind.HOURLY, clock.instant());
        assertTrue(cache.lastKnown("10.0.0.1", "reports", next).isEmpty());
    }
}

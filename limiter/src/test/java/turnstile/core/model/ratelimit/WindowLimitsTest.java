package turnstile.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.EnumSet;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WindowLimits")
class WindowLimitsTest {

    @Test
    @DisplayName("should enforce only positive limits")
    void shouldEnforceOnlyPositiveLimits() {
        var limits = WindowLimits.of(10, 0, -1, 1000);

        assertEquals(EnumSet.of(WindowKind.HOURLY, WindowKind.MONTHLY), limits.enforcedWindows());
    }

    @Test
    @DisplayName("should report the shortest exceeded window")
    void shouldReportShortestExceededWindow() {
        var limits = WindowLimits.of(10, 50, 250, 1000);
        var usage = Map.of(WindowKind.HOURLY, 10L, WindowKind.DAILY, 50L, WindowKind.WEEKLY, 3L);

        assertEquals(WindowKind.HOURLY, limits.firstExceeded(usage));
    }

    @Test
    @DisplayName("should treat usage below every limit as within limits")
    void shouldAllowUsageBelowLimits() {
        var limits = WindowLimits.of(10, 50, 250, 1000);

        assertNull(limits.firstExceeded(Map.of(WindowKind.HOURLY, 9L, WindowKind.DAILY, 49L)));
    }

    @Test
    @DisplayName("should ignore usage of windows without a limit")
    void shouldIgnoreUnenforcedWindows() {
        var limits = WindowLimits.of(10, 50, 250, 1000).restrictTo(EnumSet.of(WindowKind.DAILY));

        assertNull(limits.firstExceeded(Map.of(WindowKind.HOURLY, 500L, WindowKind.DAILY, 1L)));
        assertEquals(WindowKind.DAILY, limits.firstExceeded(Map.of(WindowKind.DAILY, 50L)));
    }
}

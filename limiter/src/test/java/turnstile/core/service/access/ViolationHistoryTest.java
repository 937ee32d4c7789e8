package turnstile.core.service.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.core.model.access.ViolationRecord;
import turnstile.core.model.ratelimit.WindowKind;

@DisplayName("ViolationHistory")
class ViolationHistoryTest {

    private static final Instant NOW = Instant.parse("2025-06-24T14:30:00Z");

    private static ViolationRecord violation(String identity, int second) {
        return new ViolationRecord(identity, "reports", WindowKind.HOURLY, NOW.plusSeconds(second));
    }

    @Test
    @DisplayName("should keep only the latest violations per identity, oldest first")
    void shouldKeepLatestViolations() {
        var history = new ViolationHistory(50, 100);

        for (int i = 0; i < 60; i++) {
            history.record(violation("10.0.0.1", i));
        }

        var recent = history.recent("10.0.0.1");
        assertEquals(50, recent.size());
        assertEquals(NOW.plusSeconds(10), recent.get(0).at());
        assertEquals(NOW.plusSeconds(59), recent.get(49).at());
    }

    @Test
    @DisplayName("should keep identities apart and forget on request")
    void shouldSeparateIdentities() {
        var history = new ViolationHistory(5, 100);
        history.record(violation("10.0.0.1", 0));
        history.record(violation("10.0.0.2", 1));

        history.forget("10.0.0.1");

        assertTrue(history.recent("10.0.0.1").isEmpty());
        assertEquals(1, history.recent("10.0.0.2").size());
    }

    @Test
    @DisplayName("should bound the number of remembered identities")
    void shouldBoundIdentities() {
        var history = new ViolationHistory(5, 10);

        for (int i = 0; i < 1_000; i++) {
            history.record(violation("10.0." + (i / 256) + "." + (i % 256), i));
        }

        var remembered = 0;
        for (int i = 0; i < 1_000; i++) {
            if (!history.recent("10.0." + (i / 256) + "." + (i % 256)).isEmpty()) {
                remembered++;
            }
        }
        assertTrue(remembered <= 10, "remembered " + remembered);
    }

    @Test
    @DisplayName("should reject a non-positive history size")
    void shouldRejectNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new ViolationHistory(0, 10));
    }
}

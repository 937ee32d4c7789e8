package turnstile.core.model.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.core.model.ratelimit.WindowKind;

@DisplayName("Decision")
class DecisionTest {

    private static final Instant NOW = Instant.parse("2025-06-24T14:30:00Z");

    @Test
    @DisplayName("allow-list bypass should be allowed and carry no window data")
    void allowListedBypassShouldSkipWindows() {
        var decision = Decision.allowListedBypass();

        assertTrue(decision.allowed());
        assertTrue(decision.allowListed());
        assertEquals(DecisionReason.ALLOWED, decision.reason());
        assertTrue(decision.usage().isEmpty());
        assertEquals(PenaltyLevel.CLEAN, decision.penaltyLevel());
    }

    @Test
    @DisplayName("a regular allow should not be marked allow-listed")
    void allowShouldNotBeAllowListed() {
        var decision = Decision.allow(
                Map.of(WindowKind.HOURLY, 1L), Map.of(WindowKind.HOURLY, 10L), Map.of(), PenaltyLevel.CLEAN);

        assertTrue(decision.allowed());
        assertFalse(decision.allowListed());
        assertNull(decision.exceededWindow());
        assertEquals(Duration.ZERO, decision.remainingTime());
    }

    @Test
    @DisplayName("withPenalty() should keep the denial and replace the penalty fields")
    void withPenaltyShouldKeepDenial() {
        var denied = Decision.rateLimited(
                WindowKind.HOURLY, Map.of(WindowKind.HOURLY, 10L), Map.of(WindowKind.HOURLY, 10L), Map.of(),
                PenaltyLevel.CLEAN);

        var updated = denied.withPenalty(
                PenaltyLevel.TEMPORARILY_BLOCKED, NOW.plusSeconds(300), Duration.ofMinutes(5));

        assertFalse(updated.allowed());
        assertEquals(DecisionReason.RATE_LIMIT_EXCEEDED, updated.reason());
        assertEquals(WindowKind.HOURLY, updated.exceededWindow());
        assertEquals(PenaltyLevel.TEMPORARILY_BLOCKED, updated.penaltyLevel());
        assertEquals(NOW.plusSeconds(300), updated.blockExpiresAt());
    }
}

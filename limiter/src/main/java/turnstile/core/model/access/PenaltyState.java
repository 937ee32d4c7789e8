package turnstile.core.model.access;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Violation history of a single identity.
 *
 * <p>A block whose expiry lies in the past is treated as no block. A ban is
 * terminal until an administrative reset deletes the state.
 *
 * @param identity the identity the state belongs to
 * @param violationCount rate limit violations recorded so far
 * @param lastViolationAt time of the most recent violation
 * @param blockExpiresAt end of the current temporary block, or null
 * @param banned whether the identity is permanently banned
 * @param blockCount number of temporary blocks applied so far
 */
public record PenaltyState(
        String identity,
        int violationCount,
        Instant lastViolationAt,
        Instant blockExpiresAt,
        boolean banned,
        int blockCount) {

    public PenaltyState {
        Objects.requireNonNull(identity, "identity must not be null");
    }

    /**
     * State of an identity with no recorded violations.
     */
    public static PenaltyState clean(String identity) {
        return new PenaltyState(identity, 0, null, null, false, 0);
    }

    /**
     * Whether a temporary block is in force at {@code now}.
     */
    public boolean isBlocked(Instant now) {
        return blockExpiresAt != null && blockExpiresAt.isAfter(now);
    }

    /**
     * Time left on the current block, or zero when not blocked.
     */
    public Duration remainingBlock(Instant now) {
        return isBlocked(now) ? Duration.between(now, blockExpiresAt) : Duration.ZERO;
    }

    /**
     * Whether the state can be forgotten: not banned, not blocked, and no
     * violation since {@code now - retention}.
     */
    public boolean isStale(Duration retention, Instant now) {
        if (banned || isBlocked(now)) {
            return false;
        }
        return lastViolationAt == null || lastViolationAt.isBefore(now.minus(retention));
    }

    /**
     * Derives the escalation level at {@code now}.
     *
     * @param now current time
     * @param thresholds escalation thresholds
     * @return the current level
     */
    public PenaltyLevel level(Instant now, PenaltyThresholds thresholds) {
        if (banned) {
            return PenaltyLevel.PERMANENTLY_BANNED;
        }
        if (isBlocked(now)) {
            return PenaltyLevel.TEMPORARILY_BLOCKED;
        }
        if (violationCount >= thresholds.soft()) {
            return PenaltyLevel.WARNED;
        }
        return PenaltyLevel.CLEAN;
    }
}

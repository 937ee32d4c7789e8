package turnstile.core.model.access;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import turnstile.core.model.ratelimit.WindowKind;

/**
 * Outcome of an access evaluation. Decisions are never persisted.
 *
 * @param allowed whether the request may proceed
 * @param reason why the decision was reached
 * @param usage observed usage per enforced window
 * @param limits limits per enforced window
 * @param resetAt window boundary per enforced window
 * @param blockExpiresAt end of the temporary block, when blocked
 * @param remainingTime time left on the block, zero otherwise
 * @param exceededWindow the window that was exceeded, for rate limit denials
 * @param penaltyLevel the identity's escalation level
 * @param allowListed whether an allow-list entry bypassed the window checks
 */
public record Decision(
        boolean allowed,
        DecisionReason reason,
        Map<WindowKind, Long> usage,
        Map<WindowKind, Long> limits,
        Map<WindowKind, Instant> resetAt,
        Instant blockExpiresAt,
        Duration remainingTime,
        WindowKind exceededWindow,
        PenaltyLevel penaltyLevel,
        boolean allowListed) {

    public Decision {
        usage = usage == null ? Map.of() : Map.copyOf(usage);
        limits = limits == null ? Map.of() : Map.copyOf(limits);
        resetAt = resetAt == null ? Map.of() : Map.copyOf(resetAt);
        remainingTime = remainingTime == null ? Duration.ZERO : remainingTime;
        penaltyLevel = penaltyLevel == null ? PenaltyLevel.CLEAN : penaltyLevel;
    }

    /**
     * Allowed after checking every enforced window.
     */
    public static Decision allow(
            Map<WindowKind, Long> usage,
            Map<WindowKind, Long> limits,
            Map<WindowKind, Instant> resetAt,
            PenaltyLevel level) {
        return new Decision(true, DecisionReason.ALLOWED, usage, limits, resetAt, null, null, null, level, false);
    }

    /**
     * Allowed by an allow-list entry without window checks.
     */
    public static Decision allowListedBypass() {
        return new Decision(
                true, DecisionReason.ALLOWED, null, null, null, null, null, null, PenaltyLevel.CLEAN, true);
    }

    /**
     * Denied by the deny-list or a ban.
     */
    public static Decision blacklisted(PenaltyLevel level) {
        return new Decision(false, DecisionReason.IP_BLACKLISTED, null, null, null, null, null, null, level, false);
    }

    public static Decision geoRestricted() {
        return new Decision(
                false, DecisionReason.GEO_RESTRICTED, null, null, null, null, null, null, PenaltyLevel.CLEAN, false);
    }

    /**
     * Denied while a temporary block is in force.
     */
    public static Decision temporarilyBlocked(Instant blockExpiresAt, Duration remaining) {
        return new Decision(
                false,
                DecisionReason.TEMPORARILY_BLOCKED,
                null,
                null,
                null,
                blockExpiresAt,
                remaining,
                null,
                PenaltyLevel.TEMPORARILY_BLOCKED,
                false);
    }

    /**
     * Denied because an enforced window is at its limit.
     */
    public static Decision rateLimited(
            WindowKind exceeded,
            Map<WindowKind, Long> usage,
            Map<WindowKind, Long> limits,
            Map<WindowKind, Instant> resetAt,
            PenaltyLevel level) {
        return new Decision(
                false, DecisionReason.RATE_LIMIT_EXCEEDED, usage, limits, resetAt, null, null, exceeded, level, false);
    }

    /**
     * Returns a copy carrying the given penalty state, as updated after the decision.
     */
    public Decision withPenalty(PenaltyLevel level, Instant blockExpiry, Duration remaining) {
        return new Decision(
                allowed, reason, usage, limits, resetAt, blockExpiry, remaining, exceededWindow, level, allowListed);
    }
}

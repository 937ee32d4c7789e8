package turnstile.core.model.access;

import java.time.Instant;
import java.util.Map;

import turnstile.core.model.ratelimit.WindowKind;

/**
 * Current usage of an identity for one consumer, read without consuming quota.
 *
 * @param identity the normalized identity
 * @param consumer the normalized consumer
 * @param usage requests counted per enforced window
 * @param limits limit per enforced window
 * @param resetAt end of the current window, per enforced window
 */
public record UsageReport(
        String identity,
        String consumer,
        Map<WindowKind, Long> usage,
        Map<WindowKind, Long> limits,
        Map<WindowKind, Instant> resetAt) {

    public UsageReport {
        usage = Map.copyOf(usage);
        limits = Map.copyOf(limits);
        resetAt = Map.copyOf(resetAt);
    }

    /**
     * Requests left in a window before its limit, 0 once reached.
     */
    public long remaining(WindowKind kind) {
        final var limit = limits.get(kind);
        if (limit == null) {
            return 0;
        }
        return Math.max(0, limit - usage.getOrDefault(kind, 0L));
    }
}

package turnstile.core.model.ratelimit;

import java.time.Instant;
import java.util.Objects;

/**
 * Usage counter for one identity, consumer and window instance.
 *
 * <p>Counts only ever grow within a window. A record is dead once
 * {@code expiresAt} has passed and is removed by the storage janitor.
 *
 * @param count requests counted in the window
 * @param windowKind the window kind
 * @param consumer the consumer the count belongs to
 * @param windowId the window identifier
 * @param expiresAt the window boundary
 * @param lastIncrementAt time of the last increment, or null for migrated legacy values
 */
public record WindowRecord(
        long count, WindowKind windowKind, String consumer, String windowId, Instant expiresAt, Instant lastIncrementAt) {

    public WindowRecord {
        Objects.requireNonNull(windowKind, "windowKind must not be null");
        Objects.requireNonNull(consumer, "consumer must not be null");
        Objects.requireNonNull(windowId, "windowId must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
    }

    /**
     * Creates a zero-count record for a window that has no stored counter yet.
     *
     * @param key the window
     * @param consumer the consumer
     * @return an empty record
     */
    public static WindowRecord empty(WindowKey key, String consumer) {
        return new WindowRecord(0, key.kind(), consumer, key.windowId(), key.expiresAt(), null);
    }

    /**
     * Returns the record that results from one more request at {@code now}.
     *
     * @param key the window being incremented
     * @param now time of the increment
     * @return the incremented record
     */
    public WindowRecord increment(WindowKey key, Instant now) {
        return new WindowRecord(count + 1, key.kind(), consumer, key.windowId(), key.expiresAt(), now);
    }

    /**
     * Whether the window has closed.
     *
     * @param now current time
     * @return true once {@code now} reaches {@code expiresAt}
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}

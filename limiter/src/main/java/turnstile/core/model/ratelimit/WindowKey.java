package turnstile.core.model.ratelimit;

import java.time.Instant;
import java.util.Objects;

/**
 * Canonical identifier of one window instance and the instant it closes.
 *
 * @param kind the window kind
 * @param windowId canonical identifier, e.g. {@code 2025-06-24-14} or {@code 2025-W26}
 * @param expiresAt the exclusive end of the window
 */
public record WindowKey(WindowKind kind, String windowId, Instant expiresAt) {

    public WindowKey {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(windowId, "windowId must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    /**
     * Storage key for a counter in this window.
     *
     * <p>Format: {@code counter:{kind}:{windowId}:{consumer}}
     *
     * @param consumer the consumer name
     * @return the storage key
     */
    public String counterKey(String consumer) {
        return new CounterKey(kind, windowId, consumer).format();
    }
}

package turnstile.core.model.ratelimit;

import java.time.Duration;
import java.util.Locale;

import turnstile.core.model.common.InvalidWindowKindException;

/**
 * Calendar-aligned rate limit windows.
 *
 * <p>Every window is computed in UTC. The nominal length is used only as the
 * TTL of best-effort fallback counters; real window boundaries come from
 * {@link WindowKeyer}.
 */
public enum WindowKind {
    HOURLY("hourly", Duration.ofHours(1)),
    DAILY("daily", Duration.ofDays(1)),
    WEEKLY("weekly", Duration.ofDays(7)),
    MONTHLY("monthly", Duration.ofDays(30));

    private final String key;
    private final Duration nominalLength;

    WindowKind(String key, Duration nominalLength) {
        this.key = key;
        this.nominalLength = nominalLength;
    }

    /**
     * Lower-case name used in storage keys.
     *
     * @return the storage key segment, e.g. {@code hourly}
     */
    public String key() {
        return key;
    }

    /**
     * Nominal window length (30 days for monthly windows).
     *
     * @return the nominal length
     */
    public Duration nominalLength() {
        return nominalLength;
    }

    /**
     * Parses a window kind from its storage key or enum name, ignoring case.
     *
     * @param value the value to parse
     * @return the window kind
     * @throws InvalidWindowKindException if the value names no window kind
     */
    public static WindowKind parse(String value) {
        if (value == null) {
            throw new InvalidWindowKindException(null);
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        throw new InvalidWindowKindException(value);
    }
}

package turnstile.core.model.ratelimit;

import java.util.Objects;
import java.util.Optional;

/**
 * Parsed form of a counter storage key.
 *
 * <p>Format: {@code counter:{kind}:{windowId}:{consumer}}. Consumer names may
 * themselves contain colons; window identifiers never do.
 *
 * @param kind the window kind
 * @param windowId the window identifier
 * @param consumer the consumer name
 */
public record CounterKey(WindowKind kind, String windowId, String consumer) {

    public static final String PREFIX = "counter:";

    public CounterKey {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(windowId, "windowId must not be null");
        Objects.requireNonNull(consumer, "consumer must not be null");
    }

    public String format() {
        return PREFIX + kind.key() + ":" + windowId + ":" + consumer;
    }

    /**
     * Parses a storage key.
     *
     * @param storageKey the key to parse
     * @return the parsed key, empty if the key is not a counter key
     * @throws turnstile.core.model.common.InvalidWindowKindException if the kind segment is unknown
     */
    public static Optional<CounterKey> parse(String storageKey) {
        if (storageKey == null || !storageKey.startsWith(PREFIX)) {
            return Optional.empty();
        }
        final var parts = storageKey.substring(PREFIX.length()).split(":", 3);
        if (parts.length != 3 || parts[1].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CounterKey(WindowKind.parse(parts[0]), parts[1], parts[2]));
    }
}

package turnstile.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for the key/value store behind the fallback counter tier.
 *
 * <p>The store offers no compare-and-set, so increments built on it may lose
 * updates under contention.
 */
public interface FallbackCounterStore {

    /**
     * @param key the counter key
     * @return the stored count, empty if missing or expired
     */
    Uni<Optional<Long>> get(String key);

    /**
     * Store a count that expires after {@code ttl}.
     *
     * @param key the counter key
     * @param value the count
     * @param ttl time to live
     * @return completion signal
     */
    Uni<Void> put(String key, long value, Duration ttl);

    /**
     * Remove expired entries.
     *
     * @return the number of entries removed
     */
    Uni<Long> evictExpired();
}

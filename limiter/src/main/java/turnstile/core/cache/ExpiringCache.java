package turnstile.core.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Local in-memory cache whose entries each expire at their own instant.
 *
 * <p>Used for state that is bounded by a window boundary, such as last-known
 * usage and fallback counters.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface ExpiringCache<K, V> {

    /**
     * Gets a value from the cache.
     *
     * @param key the cache key
     * @return the value if present and not expired
     */
    Optional<V> get(K key);

    /**
     * Puts a value that expires at {@code expiresAt}.
     *
     * <p>A value whose expiry is not in the future is not stored.
     *
     * @param key the cache key
     * @param value the value
     * @param expiresAt when the entry expires
     */
    void put(K key, V value, Instant expiresAt);

    /**
     * Removes a single entry.
     *
     * @param key the cache key
     */
    void invalidate(K key);

    /**
     * Evicts every expired entry now.
     *
     * @return the number of entries evicted
     */
    long evictExpired();

    /**
     * Returns the estimated number of entries in the cache.
     *
     * @return estimated entry count
     */
    long estimatedSize();
}

package turnstile.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for counter, penalty and access-list storage.
 *
 * <p>Configuration prefix: {@code turnstile.storage}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TURNSTILE_STORAGE_BACKEND} - {@code memory} or {@code redis}</li>
 *   <li>{@code TURNSTILE_STORAGE_PRIMARY_TIMEOUT} - Timeout for counter operations</li>
 * </ul>
 */
@ConfigMapping(prefix = "turnstile.storage")
public interface StorageConfig {

    String BACKEND_MEMORY = "memory";
    String BACKEND_REDIS = "redis";

    /**
     * Storage backend.
     *
     * <p>When {@code redis} is selected but no Redis client is available,
     * in-memory storage is used instead.
     *
     * @return backend name (default: memory)
     */
    @WithDefault(BACKEND_MEMORY)
    String backend();

    /**
     * Timeout for primary counter storage calls. A timeout counts as a failure.
     *
     * @return timeout (default: 250ms)
     */
    @WithDefault("PT0.25S")
    Duration primaryTimeout();

    /**
     * Timeout for penalty and access-list storage calls.
     *
     * @return timeout (default: 250ms)
     */
    @WithDefault("PT0.25S")
    Duration auxiliaryTimeout();

    /**
     * @return maximum entries in the last-known usage cache (default: 100000)
     */
    @WithDefault("100000")
    long usageCacheMaxEntries();

    /**
     * Redis-specific settings.
     */
    Redis redis();

    interface Redis {

        /**
         * @return prefix for every key written (default: turnstile:)
         */
        @WithDefault("turnstile:")
        String keyPrefix();

        /**
         * @return COUNT hint for key scans (default: 100)
         */
        @WithDefault("100")
        int scanCount();
    }
}

package turnstile.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the fallback counter tier.
 *
 * <p>Configuration prefix: {@code turnstile.fallback}
 *
 * <p>The fallback tier only serves requests while primary counter storage is
 * unavailable. Increments are optimistic and retried with exponential backoff.
 */
@ConfigMapping(prefix = "turnstile.fallback")
public interface FallbackConfig {

    /**
     * @return retries after the first failed attempt (default: 3)
     */
    @WithDefault("3")
    int maxRetries();

    /**
     * @return delay before the first retry (default: 100ms)
     */
    @WithDefault("PT0.1S")
    Duration baseBackoff();

    /**
     * @return upper bound for the retry delay (default: 1s)
     */
    @WithDefault("PT1S")
    Duration maxBackoff();

    /**
     * Jitter factor applied to each retry delay, between 0 and 1.
     *
     * @return jitter (default: 0.5)
     */
    @WithDefault("0.5")
    double jitter();

    /**
     * @return maximum entries held by the local fallback store (default: 100000)
     */
    @WithDefault("100000")
    long maxEntries();
}

package turnstile.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the storage janitor.
 *
 * <p>Configuration prefix: {@code turnstile.janitor}
 */
@ConfigMapping(prefix = "turnstile.janitor")
public interface JanitorConfig {

    /**
     * @return true if scheduled sweeps run (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Sweep interval in scheduler syntax, read by the scheduled trigger.
     *
     * @return interval (default: 1h)
     */
    @WithDefault("1h")
    String interval();

    /**
     * Age after which counters and idle penalty states are removed.
     *
     * @return retention (default: 31 days)
     */
    @WithDefault("P31D")
    Duration retention();
}

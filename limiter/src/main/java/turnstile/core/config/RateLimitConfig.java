package turnstile.core.config;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for per-consumer window limits.
 *
 * <p>Configuration prefix: {@code turnstile.rate-limit}
 *
 * <p>Limits are resolved per consumer. A consumer without an entry under
 * {@code consumers} uses the {@code defaults} group, and a consumer entry that
 * leaves a window out inherits the default for that window. A limit of zero
 * or less disables the window.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TURNSTILE_RATE_LIMIT_ENABLED} - Enable/disable window enforcement</li>
 *   <li>{@code TURNSTILE_RATE_LIMIT_WINDOWS} - Comma-separated window kinds to enforce</li>
 *   <li>{@code TURNSTILE_RATE_LIMIT_DEFAULTS_HOURLY} - Default hourly limit</li>
 * </ul>
 *
 * @see turnstile.adapter.out.config.ConfiguredLimitsProvider
 */
@ConfigMapping(prefix = "turnstile.rate-limit")
public interface RateLimitConfig {

    /**
     * Enable window enforcement.
     *
     * <p>When disabled, deny-list, geo and penalty checks still apply but no
     * window is enforced.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Window kinds to enforce.
     *
     * @return window kind names (default: all four)
     */
    @WithDefault("hourly,daily,weekly,monthly")
    Set<String> windows();

    /**
     * Limits applied to consumers without their own entry.
     */
    Defaults defaults();

    /**
     * Per-consumer limit overrides keyed by consumer name.
     */
    @WithName("consumers")
    Map<String, ConsumerLimits> consumers();

    /**
     * Default limit per window.
     */
    interface Defaults {

        /**
         * @return requests per hour (default: 10)
         */
        @WithDefault("10")
        long hourly();

        /**
         * @return requests per day (default: 50)
         */
        @WithDefault("50")
        long daily();

        /**
         * @return requests per week (default: 250)
         */
        @WithDefault("250")
        long weekly();

        /**
         * @return requests per month (default: 1000)
         */
        @WithDefault("1000")
        long monthly();
    }

    /**
     * Limit overrides for one consumer. Absent windows inherit the defaults.
     */
    interface ConsumerLimits {

        Optional<Long> hourly();

        Optional<Long> daily();

        Optional<Long> weekly();

        Optional<Long> monthly();
    }
}

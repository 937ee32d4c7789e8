package turnstile.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for metric recording.
 *
 * <p>Configuration prefix: {@code turnstile.metrics}
 */
@ConfigMapping(prefix = "turnstile.metrics")
public interface MetricsConfig {

    /**
     * @return true if metrics are recorded (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Upper bound on identities remembered for the unique-identity count.
     *
     * @return maximum tracked identities (default: 100000)
     */
    @WithDefault("100000")
    long maxTrackedIdentities();
}

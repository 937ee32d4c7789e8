package turnstile.core.port.out;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.ratelimit.WindowLimits;

/**
 * Port interface for resolving the window limits of a consumer.
 */
public interface LimitsProvider {

    /**
     * Resolve the limits that apply to {@code consumer}.
     *
     * <p>May fail with {@link turnstile.core.model.common.ConfigurationMissingException}
     * when no limits can be resolved.
     *
     * @param consumer the consumer name
     * @return the limits to enforce
     */
    Uni<WindowLimits> limitsFor(String consumer);
}

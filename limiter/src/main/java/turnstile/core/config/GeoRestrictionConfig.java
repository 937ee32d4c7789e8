package turnstile.core.config;

import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;

/**
 * Configuration mapping for country-based restrictions.
 *
 * <p>Configuration prefix: {@code turnstile.geo}
 *
 * <p>A request is restricted when its country is blocked, or when an allow set
 * is configured and does not contain it. Requests with an unknown country are
 * never restricted.
 */
@ConfigMapping(prefix = "turnstile.geo")
public interface GeoRestrictionConfig {

    /**
     * @return ISO country codes to reject
     */
    Optional<Set<String>> blockedCountries();

    /**
     * @return ISO country codes to accept exclusively, when present
     */
    Optional<Set<String>> allowedCountries();
}

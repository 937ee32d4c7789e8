package turnstile.adapter.out.config;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.RateLimitConfig;
import turnstile.core.model.common.ConfigurationMissingException;
import turnstile.core.model.ratelimit.WindowKind;
import turnstile.core.model.ratelimit.WindowLimits;
import turnstile.core.port.out.LimitsProvider;

/**
 * Resolves consumer limits from {@link RateLimitConfig}.
 *
 * <p>A consumer's own entry overrides the defaults window by window. Only the
 * configured window kinds are returned, and nothing is enforced while window
 * enforcement is disabled.
 */
@ApplicationScoped
public class ConfiguredLimitsProvider implements LimitsProvider {

    private static final Logger LOG = Logger.getLogger(ConfiguredLimitsProvider.class);

    private final RateLimitConfig config;
    private final Set<WindowKind> enforced;

    @Inject
    public ConfiguredLimitsProvider(RateLimitConfig config) {
        this.config = config;
        this.enforced = EnumSet.noneOf(WindowKind.class);
        for (var name : config.windows()) {
            enforced.add(WindowKind.parse(name));
        }
        LOG.infof("Enforcing windows %s (enabled=%s)", enforced, config.enabled());
    }

    @Override
    public Uni<WindowLimits> limitsFor(String consumer) {
        return Uni.createFrom().item(() -> resolve(consumer));
    }

    private WindowLimits resolve(String consumer) {
        if (!config.enabled()) {
            return new WindowLimits(null);
        }
        final var defaults = config.defaults();
        if (defaults == null) {
            throw new ConfigurationMissingException("No default limits configured");
        }
        final var override = Optional.ofNullable(config.consumers())
                .map(consumers -> consumers.get(consumer));

        final var limits = new EnumMap<WindowKind, Long>(WindowKind.class);
        limits.put(WindowKind.HOURLY, override.flatMap(RateLimitConfig.ConsumerLimits::hourly).orElse(defaults.hourly()));
        limits.put(WindowKind.DAILY, override.flatMap(RateLimitConfig.ConsumerLimits::daily).orElse(defaults.daily()));
        limits.put(WindowKind.WEEKLY, override.flatMap(RateLimitConfig.ConsumerLimits::weekly).orElse(defaults.weekly()));
        limits.put(
                WindowKind.MONTHLY, override.flatMap(RateLimitConfig.ConsumerLimits::monthly).orElse(defaults.monthly()));
        return new WindowLimits(limits).restrictTo(enforced);
    }
}

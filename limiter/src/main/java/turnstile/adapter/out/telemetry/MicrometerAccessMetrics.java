package turnstile.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import turnstile.core.config.MetricsConfig;
import turnstile.core.model.access.DecisionReason;
import turnstile.core.model.access.PenaltyLevel;
import turnstile.core.port.out.AccessMetrics;

/**
 * Records admission-control metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code turnstile.decisions.total} - Decisions by reason</li>
 *   <li>{@code turnstile.counter.fallback.total} - Counter operations served by the fallback tier</li>
 *   <li>{@code turnstile.counter.fail_open.total} - Counter operations that failed open</li>
 *   <li>{@code turnstile.storage.timeouts.total} - Storage timeouts by repository and operation</li>
 *   <li>{@code turnstile.storage.failures.total} - Storage failures by repository and operation</li>
 *   <li>{@code turnstile.penalty.escalations.total} - Escalations by penalty level</li>
 *   <li>{@code turnstile.janitor.deleted.total} - Entries deleted by the janitor, by tier</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAccessMetrics implements AccessMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAccessMetrics(MeterRegistry registry, MetricsConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDecision(DecisionReason reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.decisions.total")
                .description("Access decisions by reason")
                .tag("reason", reason.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordCounterFallback(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.counter.fallback.total")
                .description("Counter operations served by the fallback tier")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordCounterFailOpen(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.counter.fail_open.total")
                .description("Counter operations that failed open on both tiers")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStorageTimeout(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.storage.timeouts.total")
                .description("Storage operation timeouts")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStorageFailure(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.storage.failures.total")
                .description("Storage operation failures other than timeouts")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordPenaltyEscalation(PenaltyLevel level) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.penalty.escalations.total")
                .description("Penalty escalations by level reached")
                .tag("level", level.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordJanitorDeleted(String tier, long count) {
        if (!enabled || count <= 0) {
            return;
        }

        Counter.builder("turnstile.janitor.deleted.total")
                .description("Entries deleted by the storage janitor")
                .tag("tier", tier)
                .register(registry)
                .increment(count);
    }
}

package turnstile.core.service.access;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import turnstile.core.config.MetricsConfig;
import turnstile.core.model.access.Decision;
import turnstile.core.model.access.DecisionReason;

/**
 * In-process counters for produced decisions. Nothing is persisted; the
 * counters start from zero on every startup.
 *
 * <p>Distinct identities are kept in a size-bounded cache, so
 * {@link #uniqueIdentities()} never exceeds the configured maximum and
 * undercounts once more identities than that have been seen.
 */
@ApplicationScoped
public class DecisionStatistics {

    static final long DEFAULT_MAX_TRACKED_IDENTITIES = 100_000;

    private final LongAdder total = new LongAdder();
    private final LongAdder allowed = new LongAdder();
    private final LongAdder violations = new LongAdder();
    private final Map<DecisionReason, LongAdder> byReason = new EnumMap<>(DecisionReason.class);
    private final Cache<String, Boolean> identities;

    @Inject
    public DecisionStatistics(MetricsConfig config) {
        this(config.maxTrackedIdentities());
    }

    public DecisionStatistics() {
        this(DEFAULT_MAX_TRACKED_IDENTITIES);
    }

    public DecisionStatistics(long maxTrackedIdentities) {
        this.identities = Caffeine.newBuilder()
                .maximumSize(maxTrackedIdentities)
                .executor(Runnable::run)
                .build();
        for (var reason : DecisionReason.values()) {
            byReason.put(reason, new LongAdder());
        }
    }

    /**
     * Count one decision for an identity.
     *
     * @param identity the normalized identity
     * @param decision the decision produced
     */
    public void record(String identity, Decision decision) {
        total.increment();
        identities.put(identity, Boolean.TRUE);
        if (decision.allowed()) {
            allowed.increment();
        }
        byReason.get(decision.reason()).increment();
    }

    public void recordViolation() {
        violations.increment();
    }

    public long totalEvaluations() {
        return total.sum();
    }

    public long allowed() {
        return allowed.sum();
    }

    public long denied() {
        return total.sum() - allowed.sum();
    }

    /**
     * Distinct identities currently remembered, at most the configured bound.
     */
    public long uniqueIdentities() {
        identities.cleanUp();
        return identities.estimatedSize();
    }

    public long totalViolations() {
        return violations.sum();
    }

    /**
     * Denied decisions per reason, omitting reasons never seen.
     */
    public Map<DecisionReason, Long> denialsByReason() {
        final var result = new EnumMap<DecisionReason, Long>(DecisionReason.class);
        byReason.forEach((reason, count) -> {
            final var sum = count.sum();
            if (reason != DecisionReason.ALLOWED && sum > 0) {
                result.put(reason, sum);
            }
        });
        return result;
    }
}

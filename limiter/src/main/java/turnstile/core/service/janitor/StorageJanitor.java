package turnstile.core.service.janitor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.JanitorConfig;
import turnstile.core.model.access.JanitorReport;
import turnstile.core.model.ratelimit.SweepResult;
import turnstile.core.port.out.AccessMetrics;
import turnstile.core.port.out.CounterActorDirectory;
import turnstile.core.port.out.FallbackCounterStore;
import turnstile.spi.PenaltyRepository;

/**
 * Removes dead state from every storage tier.
 *
 * <p>Each run sweeps, in order:
 * <ol>
 *   <li>Counter storage: expired or idle window counters</li>
 *   <li>The fallback store: expired entries</li>
 *   <li>Penalty storage: idle states with no block or ban</li>
 * </ol>
 *
 * <p>A failing tier is logged and recorded in the report; the remaining
 * tiers still run.
 */
@ApplicationScoped
public class StorageJanitor {

    private static final Logger LOG = Logger.getLogger(StorageJanitor.class);

    static final String TIER_COUNTERS = "counters";
    static final String TIER_FALLBACK = "fallback";
    static final String TIER_PENALTIES = "penalties";

    private final CounterActorDirectory counters;
    private final FallbackCounterStore fallback;
    private final PenaltyRepository penalties;
    private final JanitorConfig config;
    private final AccessMetrics metrics;
    private final Clock clock;

    public StorageJanitor(
            CounterActorDirectory counters,
            FallbackCounterStore fallback,
            PenaltyRepository penalties,
            JanitorConfig config,
            AccessMetrics metrics,
            Clock clock) {
        this.counters = counters;
        this.fallback = fallback;
        this.penalties = penalties;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Scheduled sweep. Never fails, so the scheduler keeps firing.
     */
    @Scheduled(
            every = "${turnstile.janitor.interval:1h}",
            delayed = "${turnstile.janitor.interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> scheduledSweep() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        return sweep(clock.instant())
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.error("Storage janitor run failed", error);
                    return null;
                })
                .replaceWithVoid();
    }

    /**
     * Sweep every tier once.
     *
     * @param now time of the sweep
     * @return Uni with the combined report
     */
    public Uni<JanitorReport> sweep(Instant now) {
        final var retention = config.retention();
        final var failures = Collections.synchronizedList(new ArrayList<String>());

        final var counterSweep = Uni.createFrom()
                .deferred(() -> counters.sweepExpired(retention, now))
                .onFailure()
                .recoverWithItem(error -> {
                    failures.add(failure(TIER_COUNTERS, error));
                    return SweepResult.empty();
                });

        final var fallbackSweep = Uni.createFrom()
                .deferred(fallback::evictExpired)
                .onFailure()
                .recoverWithItem(error -> {
                    failures.add(failure(TIER_FALLBACK, error));
                    return 0L;
                });

        final var penaltySweep = Uni.createFrom()
                .deferred(() -> penalties.sweepStale(retention, now))
                .onFailure()
                .recoverWithItem(error -> {
                    failures.add(failure(TIER_PENALTIES, error));
                    return 0L;
                });

        return counterSweep.flatMap(counterResult -> fallbackSweep.flatMap(evicted -> penaltySweep.map(
                deleted -> report(counterResult, evicted, deleted, List.copyOf(failures)))));
    }

    private JanitorReport report(SweepResult counterResult, long evicted, long deleted, List<String> failures) {
        final var report = new JanitorReport(counterResult, evicted, deleted, failures);

        metrics.recordJanitorDeleted(TIER_COUNTERS, counterResult.deletedKeys().size());
        metrics.recordJanitorDeleted(TIER_FALLBACK, evicted);
        metrics.recordJanitorDeleted(TIER_PENALTIES, deleted);

        counterResult.errors().forEach(error ->
                LOG.warnf("Counter sweep skipped %s: %s", error.key(), error.message()));
        if (!counterResult.unknownAgeKeys().isEmpty()) {
            LOG.debugf("Counter sweep kept %d keys of unknown age", counterResult.unknownAgeKeys().size());
        }

        LOG.infof(
                "Storage janitor run complete: counters=%d, fallback=%d, penalties=%d, failures=%d",
                counterResult.deletedKeys().size(), evicted, deleted, failures.size());
        return report;
    }

    private static String failure(String tier, Throwable error) {
        LOG.warnf("Storage janitor failed to sweep %s: %s", tier, error.getMessage());
        return tier + ": " + error.getMessage();
    }
}

package turnstile.core.service.ratelimit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.cache.UsageCache;
import turnstile.core.config.StorageConfig;
import turnstile.core.model.ratelimit.WindowKey;
import turnstile.core.model.ratelimit.WindowKeyer;
import turnstile.core.model.ratelimit.WindowKind;
import turnstile.core.model.ratelimit.WindowRecord;
import turnstile.core.port.out.AccessMetrics;
import turnstile.core.port.out.CounterActorDirectory;
import turnstile.core.service.common.StorageTimeoutHelper;

/**
 * Counts usage per window through the counter actor, degrading gracefully.
 *
 * <p>Each window is served by the first tier that answers:
 * <ol>
 *   <li>The identity's counter actor, bounded by the primary timeout</li>
 *   <li>The {@link FallbackCounter}, with bounded retries</li>
 *   <li>The last usage observed for the window, or 0 if none is known</li>
 * </ol>
 *
 * <p>The returned {@link Uni} never fails. No lock is held while waiting on
 * storage.
 */
@ApplicationScoped
public class RateLimitCoordinator {

    private static final Logger LOG = Logger.getLogger(RateLimitCoordinator.class);

    static final String OPERATION_CONSUME = "consume";
    static final String OPERATION_PEEK = "peek";

    private final CounterActorDirectory directory;
    private final FallbackCounter fallback;
    private final UsageCache usageCache;
    private final AccessMetrics metrics;
    private final StorageTimeoutHelper timeoutHelper;

    public RateLimitCoordinator(
            CounterActorDirectory directory,
            FallbackCounter fallback,
            UsageCache usageCache,
            AccessMetrics metrics,
            StorageConfig storageConfig) {
        this.directory = directory;
        this.fallback = fallback;
        this.usageCache = usageCache;
        this.metrics = metrics;
        this.timeoutHelper = new StorageTimeoutHelper(storageConfig.primaryTimeout(), metrics, "counter");
    }

    /**
     * Increment every given window for the identity and consumer.
     *
     * <p>Not idempotent.
     *
     * @param identity the client identity
     * @param consumer the consumer
     * @param windows the windows to count
     * @param now time of the request
     * @return Uni with the usage per window after incrementing
     */
    public Uni<Map<WindowKind, Long>> consume(String identity, String consumer, Set<WindowKind> windows, Instant now) {
        return countAll(OPERATION_CONSUME, identity, consumer, windows, now);
    }

    /**
     * Read the usage of every given window without incrementing.
     *
     * @param identity the client identity
     * @param consumer the consumer
     * @param windows the windows to read
     * @param now time of the read
     * @return Uni with the usage per window
     */
    public Uni<Map<WindowKind, Long>> peek(String identity, String consumer, Set<WindowKind> windows, Instant now) {
        return countAll(OPERATION_PEEK, identity, consumer, windows, now);
    }

    /**
     * The current window of every kind, for reporting reset instants.
     */
    public Map<WindowKind, WindowKey> currentWindows(Instant now) {
        return WindowKeyer.currentWindows(now);
    }

    private Uni<Map<WindowKind, Long>> countAll(
            String operation, String identity, String consumer, Set<WindowKind> windows, Instant now) {
        if (windows.isEmpty()) {
            return Uni.createFrom().item(Collections.emptyMap());
        }

        final var kinds = List.copyOf(windows);
        final var counts = new ArrayList<Uni<Long>>(kinds.size());
        for (var kind : kinds) {
            counts.add(countWindow(operation, identity, consumer, kind, now));
        }

        return Uni.join().all(counts).andFailFast().map(values -> {
            final var usage = new EnumMap<WindowKind, Long>(WindowKind.class);
            for (var i = 0; i < kinds.size(); i++) {
                usage.put(kinds.get(i), values.get(i));
            }
            return Collections.unmodifiableMap(usage);
        });
    }

    private Uni<Long> countWindow(String operation, String identity, String consumer, WindowKind kind, Instant now) {
        final var window = WindowKeyer.keyFor(kind, now);

        final Uni<WindowRecord> primary = Uni.createFrom().deferred(() -> {
            final var actor = directory.actorFor(identity);
            return OPERATION_CONSUME.equals(operation)
                    ? actor.increment(kind, consumer, now)
                    : actor.read(kind, consumer, now);
        });

        return timeoutHelper
                .withTimeout(primary, operation)
                .map(WindowRecord::count)
                .onFailure()
                .recoverWithUni(error -> {
                    LOG.warnf(
                            "Counter storage unavailable for %s %s/%s, using fallback: %s",
                            operation, identity, kind.key(), error.getMessage());
                    metrics.recordCounterFallback(operation);
                    return OPERATION_CONSUME.equals(operation)
                            ? fallback.increment(identity, consumer, window, now)
                            : fallback.read(identity, consumer, window);
                })
                .invoke(count -> usageCache.remember(identity, consumer, window, count))
                .onFailure()
                .recoverWithItem(error -> {
                    final var lastKnown = usageCache.lastKnown(identity, consumer, window).orElse(0L);
                    LOG.warnf(
                            "Counter tiers unavailable for %s %s/%s, failing open with usage %d: %s",
                            operation, identity, kind.key(), lastKnown, error.getMessage());
                    metrics.recordCounterFailOpen(operation);
                    return lastKnown;
                });
    }
}

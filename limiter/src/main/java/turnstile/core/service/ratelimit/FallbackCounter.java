package turnstile.core.service.ratelimit;

import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.FallbackConfig;
import turnstile.core.model.common.StorageDegradedException;
import turnstile.core.model.ratelimit.WindowKey;
import turnstile.core.port.out.FallbackCounterStore;

/**
 * Best-effort window counter used while primary counter storage is down.
 *
 * <p>Increments read the current count, add one and write the result back
 * with a TTL of the window length capped at the window boundary. The store
 * has no compare-and-set, so concurrent increments can lose updates. Failed
 * attempts are retried with exponential backoff and jitter; once retries are
 * exhausted the failure surfaces as {@link StorageDegradedException}.
 *
 * <p>Key format: {@code fallback:{identity}:{consumer}:{kind}:{windowId}}
 */
@ApplicationScoped
public class FallbackCounter {

    private static final Logger LOG = Logger.getLogger(FallbackCounter.class);

    private final FallbackCounterStore store;
    private final FallbackConfig config;

    public FallbackCounter(FallbackCounterStore store, FallbackConfig config) {
        this.store = store;
        this.config = config;
    }

    /**
     * Increment the fallback counter of a window.
     *
     * @param identity the client identity
     * @param consumer the consumer
     * @param window the window containing {@code now}
     * @param now time of the request
     * @return Uni with the count after incrementing
     */
    public Uni<Long> increment(String identity, String consumer, WindowKey window, Instant now) {
        final var key = key(identity, consumer, window);
        final var ttl = ttl(window, now);

        final Uni<Long> attempt = store.get(key)
                .map(current -> current.orElse(0L) + 1)
                .call(next -> store.put(key, next, ttl));

        return withRetries(attempt)
                .invoke(count -> LOG.debugf("Fallback counter %s incremented to %d", key, count))
                .onFailure()
                .transform(error -> new StorageDegradedException("Fallback increment failed for " + key, error));
    }

    /**
     * Read the fallback counter of a window.
     *
     * @param identity the client identity
     * @param consumer the consumer
     * @param window the window
     * @return Uni with the count, 0 when nothing is stored
     */
    public Uni<Long> read(String identity, String consumer, WindowKey window) {
        final var key = key(identity, consumer, window);
        return withRetries(store.get(key).map(current -> current.orElse(0L)))
                .onFailure()
                .transform(error -> new StorageDegradedException("Fallback read failed for " + key, error));
    }

    /**
     * Storage key of a fallback counter.
     */
    public static String key(String identity, String consumer, WindowKey window) {
        return "fallback:" + identity + ":" + consumer + ":" + window.kind().key() + ":" + window.windowId();
    }

    static Duration ttl(WindowKey window, Instant now) {
        final var untilBoundary = Duration.between(now, window.expiresAt());
        final var nominal = window.kind().nominalLength();
        return untilBoundary.compareTo(nominal) < 0 ? untilBoundary : nominal;
    }

    private <T> Uni<T> withRetries(Uni<T> attempt) {
        if (config.maxRetries() <= 0) {
            return attempt;
        }
        return attempt.onFailure()
                .retry()
                .withBackOff(config.baseBackoff(), config.maxBackoff())
                .withJitter(config.jitter())
                .atMost(config.maxRetries());
    }
}

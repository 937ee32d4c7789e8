package turnstile.adapter.out.fallback;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.cache.CaffeineExpiringCache;
import turnstile.core.cache.ExpiringCache;
import turnstile.core.config.FallbackConfig;
import turnstile.core.port.out.FallbackCounterStore;

/**
 * Local, bounded store for fallback counters.
 *
 * <p>Entries live in this instance only and expire after their TTL. Counts
 * kept here are best-effort and are not reconciled with primary storage.
 */
@ApplicationScoped
public class CaffeineFallbackCounterStore implements FallbackCounterStore {

    private static final Logger LOG = Logger.getLogger(CaffeineFallbackCounterStore.class);

    private final ExpiringCache<String, Long> cache;
    private final Clock clock;

    @Inject
    public CaffeineFallbackCounterStore(FallbackConfig config, Clock clock) {
        this(config.maxEntries(), clock);
    }

    public CaffeineFallbackCounterStore(long maxEntries, Clock clock) {
        this.cache = new CaffeineExpiringCache<>(maxEntries, clock);
        this.clock = clock;
    }

    @Override
    public Uni<Optional<Long>> get(String key) {
        return Uni.createFrom().item(() -> cache.get(key));
    }

    @Override
    public Uni<Void> put(String key, long value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            cache.put(key, value, clock.instant().plus(ttl));
            return null;
        });
    }

    @Override
    public Uni<Long> evictExpired() {
        return Uni.createFrom().item(() -> {
            final var evicted = cache.evictExpired();
            if (evicted > 0) {
                LOG.debugf("Evicted %d expired fallback counters", evicted);
            }
            return evicted;
        });
    }

    /**
     * Get the estimated number of entries (for testing).
     */
    public long size() {
        return cache.estimatedSize();
    }
}

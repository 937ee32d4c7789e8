package turnstile.core.cache;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import turnstile.core.config.StorageConfig;
import turnstile.core.model.ratelimit.WindowKey;

/**
 * Last-known usage per identity, consumer and window.
 *
 * <p>Consulted when both counter tiers are unavailable. Entries expire at
 * the boundary of the window they were observed in, so a stale count never
 * leaks into the next window.
 */
@ApplicationScoped
public class UsageCache {

    private final ExpiringCache<UsageKey, Long> cache;

    @Inject
    public UsageCache(StorageConfig config, Clock clock) {
        this(config.usageCacheMaxEntries(), clock);
    }

    public UsageCache(long maxEntries, Clock clock) {
        this.cache = new CaffeineExpiringCache<>(maxEntries, clock);
    }

    private record UsageKey(String identity, String consumer, String kind, String windowId) {}

    /**
     * Records an observed count.
     */
    public void remember(String identity, String consumer, WindowKey window, long count) {
        cache.put(key(identity, consumer, window), count, window.expiresAt());
    }

    /**
     * Returns the last observed count for the window, if still current.
     */
    public Optional<Long> lastKnown(String identity, String consumer, WindowKey window) {
        return cache.get(key(identity, consumer, window));
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private static UsageKey key(String identity, String consumer, WindowKey window) {
        return new UsageKey(identity, consumer, window.kind().key(), window.windowId());
    }
}

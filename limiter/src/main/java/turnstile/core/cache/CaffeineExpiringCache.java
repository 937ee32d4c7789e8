package turnstile.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;

/**
 * Caffeine-backed cache with a per-entry expiry instant.
 *
 * <p>Caffeine reads time through a ticker derived from the supplied
 * {@link Clock}, so entry lifetimes follow the same clock as the window
 * calculations. Removal notifications run on the calling thread, which lets
 * {@link #evictExpired()} report how many entries a cleanup removed.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineExpiringCache<K, V> implements ExpiringCache<K, V> {

    private final Cache<K, Entry<V>> cache;
    private final Clock clock;
    private final LongAdder expired = new LongAdder();

    /**
     * Create a new cache.
     *
     * @param maxSize the maximum number of entries
     * @param clock   time source for expiry
     */
    public CaffeineExpiringCache(long maxSize, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .expireAfter(new EntryExpiry())
                .removalListener((K key, Entry<V> entry, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) {
                        expired.increment();
                    }
                })
                .build();
    }

    private record Entry<V>(V value, Instant expiresAt) {}

    /**
     * Expires each entry at its own instant, measured against the clock.
     */
    private class EntryExpiry implements Expiry<K, Entry<V>> {
        @Override
        public long expireAfterCreate(K key, Entry<V> entry, long currentTime) {
            return remaining(entry);
        }

        @Override
        public long expireAfterUpdate(K key, Entry<V> entry, long currentTime, long currentDuration) {
            return remaining(entry);
        }

        @Override
        public long expireAfterRead(K key, Entry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remaining(Entry<V> entry) {
            final var nanos = Duration.between(clock.instant(), entry.expiresAt()).toNanos();
            return Math.max(0, nanos);
        }
    }

    @Override
    public Optional<V> get(K key) {
        final var entry = cache.getIfPresent(key);
        if (entry == null || !entry.expiresAt().isAfter(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(K key, V value, Instant expiresAt) {
        if (!expiresAt.isAfter(clock.instant())) {
            cache.invalidate(key);
            return;
        }
        cache.put(key, new Entry<>(value, expiresAt));
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public long evictExpired() {
        final var before = expired.sum();
        cache.cleanUp();
        return expired.sum() - before;
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}

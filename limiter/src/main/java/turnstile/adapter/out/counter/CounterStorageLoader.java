package turnstile.adapter.out.counter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import turnstile.adapter.out.counter.memory.InMemoryCounterStorageProvider;
import turnstile.adapter.out.counter.redis.RedisCounterStorageProvider;
import turnstile.core.config.JanitorConfig;
import turnstile.core.config.StorageConfig;
import turnstile.core.port.out.CounterActorDirectory;
import turnstile.spi.CounterStorageProvider;

/**
 * CDI producer for counter storage.
 *
 * <p>Collects the providers enabled by configuration and picks the
 * available one with the highest {@link CounterStorageProvider#priority()}:
 * <ul>
 *   <li>Redis (priority 10) - Used when the redis backend is configured and a data source exists</li>
 *   <li>In-memory (priority 0) - Fallback, always available</li>
 * </ul>
 */
@ApplicationScoped
public class CounterStorageLoader {

    private static final Logger LOG = Logger.getLogger(CounterStorageLoader.class);

    private final StorageConfig storageConfig;
    private final JanitorConfig janitorConfig;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public CounterStorageLoader(
            StorageConfig storageConfig, JanitorConfig janitorConfig, Instance<ReactiveRedisDataSource> redisDataSource) {
        this.storageConfig = storageConfig;
        this.janitorConfig = janitorConfig;
        this.redisDataSource = redisDataSource;
    }

    /**
     * Produces the counter actor directory for CDI injection.
     *
     * @return the configured directory
     */
    @Produces
    @ApplicationScoped
    public CounterActorDirectory produceCounterActorDirectory() {
        final var provider = selectProvider();
        LOG.infov("Using counter storage provider: {0}", provider.name());
        return provider.createDirectory();
    }

    CounterStorageProvider selectProvider() {
        final var candidates = new ArrayList<CounterStorageProvider>();
        createRedisProvider().ifPresent(candidates::add);
        candidates.add(new InMemoryCounterStorageProvider());
        return highestPriority(candidates);
    }

    /**
     * Picks the available provider with the highest priority.
     *
     * @param candidates the candidate providers
     * @return the selected provider
     * @throws IllegalStateException if no candidate is available
     */
    static CounterStorageProvider highestPriority(List<CounterStorageProvider> candidates) {
        return candidates.stream()
                .filter(CounterStorageProvider::isAvailable)
                .max(Comparator.comparingInt(CounterStorageProvider::priority))
                .orElseThrow(() -> new IllegalStateException("No counter storage provider available"));
    }

    private Optional<CounterStorageProvider> createRedisProvider() {
        if (!StorageConfig.BACKEND_REDIS.equalsIgnoreCase(storageConfig.backend())) {
            LOG.debug("Redis counter storage not enabled in configuration");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis counter storage configured but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            final var redis = storageConfig.redis();
            return Optional.of(RedisCounterStorageProvider.configured(
                    redisDataSource.get(), redis.keyPrefix(), redis.scanCount(), janitorConfig.retention()));
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis counter storage, falling back to in-memory");
            return Optional.empty();
        }
    }
}

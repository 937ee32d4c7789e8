package turnstile.adapter.out.storage;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import turnstile.adapter.out.storage.memory.InMemoryAccessListRepository;
import turnstile.adapter.out.storage.memory.InMemoryPenaltyRepository;
import turnstile.adapter.out.storage.redis.RedisAccessListRepository;
import turnstile.adapter.out.storage.redis.RedisPenaltyRepository;
import turnstile.core.config.StorageConfig;
import turnstile.spi.AccessListRepository;
import turnstile.spi.PenaltyRepository;

/**
 * CDI producer for penalty and access-list repositories.
 *
 * <p>Uses Redis when {@code turnstile.storage.backend=redis} and a
 * {@link ReactiveRedisDataSource} can be resolved; otherwise falls back to
 * in-memory storage.
 *
 * <p>Platform teams can provide custom implementations by registering an
 * {@code @Alternative} bean for {@link PenaltyRepository} or
 * {@link AccessListRepository}.
 */
@ApplicationScoped
public class StorageRepositoryProducer {

    private static final Logger LOG = Logger.getLogger(StorageRepositoryProducer.class);

    private final StorageConfig config;
    private final Optional<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public StorageRepositoryProducer(StorageConfig config, Instance<ReactiveRedisDataSource> redisDataSourceInstance) {
        this.config = config;
        this.redisDataSource = resolveRedis(config, redisDataSourceInstance);
    }

    @Produces
    @ApplicationScoped
    public PenaltyRepository penaltyRepository() {
        return redisDataSource
                .<PenaltyRepository>map(ds -> new RedisPenaltyRepository(
                        ds, config.redis().keyPrefix(), config.redis().scanCount()))
                .orElseGet(InMemoryPenaltyRepository::new);
    }

    @Produces
    @ApplicationScoped
    public AccessListRepository accessListRepository() {
        return redisDataSource
                .<AccessListRepository>map(ds -> new RedisAccessListRepository(
                        ds, config.redis().keyPrefix(), config.redis().scanCount()))
                .orElseGet(InMemoryAccessListRepository::new);
    }

    private static Optional<ReactiveRedisDataSource> resolveRedis(
            StorageConfig config, Instance<ReactiveRedisDataSource> instance) {
        if (!StorageConfig.BACKEND_REDIS.equalsIgnoreCase(config.backend())) {
            return Optional.empty();
        }
        if (!instance.isResolvable()) {
            LOG.warn("Redis storage configured but ReactiveRedisDataSource not available, using in-memory storage");
            return Optional.empty();
        }
        return Optional.of(instance.get());
    }
}

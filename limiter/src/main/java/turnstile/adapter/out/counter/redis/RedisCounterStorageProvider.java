package turnstile.adapter.out.counter.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import turnstile.core.port.out.CounterActorDirectory;
import turnstile.spi.CounterStorageProvider;

/**
 * Redis counter storage provider for multi-instance deployments.
 *
 * <p>This provider has higher priority than in-memory (10 vs 0) and is
 * selected when the Redis backend is configured and a data source exists.
 */
public final class RedisCounterStorageProvider implements CounterStorageProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final String keyPrefix;
    private final int scanCount;
    private final Duration retention;

    private RedisCounterStorageProvider(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, int scanCount, Duration retention) {
        this.redisDataSource = redisDataSource;
        this.keyPrefix = keyPrefix;
        this.scanCount = scanCount;
        this.retention = retention;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return redisDataSource != null;
    }

    @Override
    public CounterActorDirectory createDirectory() {
        if (redisDataSource == null) {
            throw new IllegalStateException("Provider not configured. Use CounterStorageLoader for initialization.");
        }
        return new RedisCounterActorDirectory(redisDataSource, keyPrefix, scanCount, retention);
    }

    /**
     * Creates a configured provider instance.
     *
     * @param redisDataSource the Redis data source
     * @param keyPrefix prefix for every key
     * @param scanCount COUNT hint for key scans
     * @param retention how long keys outlive their window
     * @return the configured provider
     */
    public static RedisCounterStorageProvider configured(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, int scanCount, Duration retention) {
        return new RedisCounterStorageProvider(redisDataSource, keyPrefix, scanCount, retention);
    }
}

package turnstile.adapter.out.counter.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.model.ratelimit.CounterKey;
import turnstile.core.model.ratelimit.CounterRetention;
import turnstile.core.model.ratelimit.StoredCounter;
import turnstile.core.model.ratelimit.SweepResult;
import turnstile.core.model.ratelimit.SweepResult.SweepError;
import turnstile.core.model.ratelimit.WindowKey;
import turnstile.core.model.ratelimit.WindowKeyer;
import turnstile.core.model.ratelimit.WindowKind;
import turnstile.core.model.ratelimit.WindowRecord;
import turnstile.core.port.out.CounterActorDirectory;

/**
 * Redis-backed counter storage shared between instances.
 *
 * <p>Key format: {@code {prefix}counter:{identity}:counter:{kind}:{windowId}:{consumer}}
 *
 * <p>Structured counters are hashes with fields {@code count}, {@code kind},
 * {@code consumer}, {@code windowId}, {@code expiresAt} and
 * {@code lastIncrementAt} (epoch milliseconds). A plain string value is a
 * legacy count and is rewritten as a hash by the next increment. Every key
 * expires {@code retention} after its window closes.
 */
public final class RedisCounterActorDirectory implements CounterActorDirectory {

    private static final Logger LOG = Logger.getLogger(RedisCounterActorDirectory.class);

    private static final String FIELD_COUNT = "count";
    private static final String FIELD_KIND = "kind";
    private static final String FIELD_CONSUMER = "consumer";
    private static final String FIELD_WINDOW_ID = "windowId";
    private static final String FIELD_EXPIRES_AT = "expiresAt";
    private static final String FIELD_LAST_INCREMENT_AT = "lastIncrementAt";

    /**
     * Lua script for an atomic increment with legacy migration.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the counter key</li>
     *   <li>ARGV[1] - current timestamp in milliseconds</li>
     *   <li>ARGV[2] - key TTL in seconds</li>
     *   <li>ARGV[3..6] - kind, consumer, window id, window expiry in milliseconds</li>
     * </ol>
     *
     * <p>Returns array: [count, migrated (0/1)]
     */
    private static final String INCREMENT_SCRIPT =
            """
            local key = KEYS[1]
            local now_ms = ARGV[1]
            local ttl = tonumber(ARGV[2])

            local value_type = redis.call('TYPE', key)['ok']
            local count = 0
            local migrated = 0
            if value_type == 'string' then
                count = tonumber(redis.call('GET', key)) or 0
                redis.call('DEL', key)
                migrated = 1
            elseif value_type == 'hash' then
                count = tonumber(redis.call('HGET', key, 'count')) or 0
            end

            count = count + 1
            redis.call('HSET', key,
                'count', count,
                'kind', ARGV[3],
                'consumer', ARGV[4],
                'windowId', ARGV[5],
                'expiresAt', ARGV[6],
                'lastIncrementAt', now_ms)
            redis.call('EXPIRE', key, ttl)
            return {count, migrated}
            """;

    /**
     * Lua script for reading a counter in either representation.
     *
     * <p>Returns array: [count, lastIncrementAt in milliseconds or 0]
     */
    private static final String READ_SCRIPT =
            """
            local key = KEYS[1]
            local value_type = redis.call('TYPE', key)['ok']
            if value_type == 'string' then
                return {tonumber(redis.call('GET', key)) or 0, 0}
            elseif value_type == 'hash' then
                local data = redis.call('HMGET', key, 'count', 'lastIncrementAt')
                return {tonumber(data[1]) or 0, tonumber(data[2]) or 0}
            end
            return {0, 0}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final String counterPrefix;
    private final int scanCount;
    private final Duration retention;

    /**
     * @param redisDataSource the Redis data source
     * @param keyPrefix prefix for every key, e.g. {@code turnstile:}
     * @param scanCount COUNT hint for key scans
     * @param retention how long keys outlive their window
     */
    public RedisCounterActorDirectory(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, int scanCount, Duration retention) {
        this.redisDataSource = redisDataSource;
        this.keyCommands = redisDataSource.key(String.class);
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.counterPrefix = keyPrefix + "counter:";
        this.scanCount = scanCount;
        this.retention = retention;
        LOG.info("Initialized Redis counter storage");
    }

    @Override
    public RedisCounterActor actorFor(String identity) {
        return new RedisCounterActor(identity, this);
    }

    @Override
    public Uni<SweepResult> sweepExpired(Duration retention, Instant now) {
        return sweep(counterPrefix + "*", retention, now);
    }

    @Override
    public Uni<Long> identityCount() {
        final var args = new KeyScanArgs().match(counterPrefix + "*").count(scanCount);
        return keyCommands
                .scan(args)
                .toMulti()
                .map(this::identityOf)
                .select()
                .where(Optional::isPresent)
                .map(Optional::get)
                .collect()
                .in(HashSet<String>::new, HashSet::add)
                .map(identities -> (long) identities.size());
    }

    Uni<WindowRecord> increment(String identity, WindowKind kind, String consumer, Instant now) {
        final var window = WindowKeyer.keyFor(kind, now);
        final var redisKey = redisKey(identity, window, consumer);
        final var ttlSeconds =
                Math.max(1, Duration.between(now, window.expiresAt()).plus(retention).toSeconds());

        return redisDataSource
                .execute(
                        "EVAL",
                        INCREMENT_SCRIPT,
                        "1", // numkeys
                        redisKey, // KEYS[1]
                        String.valueOf(now.toEpochMilli()), // ARGV[1]
                        String.valueOf(ttlSeconds), // ARGV[2]
                        kind.key(), // ARGV[3]
                        consumer, // ARGV[4]
                        window.windowId(), // ARGV[5]
                        String.valueOf(window.expiresAt().toEpochMilli()) // ARGV[6]
                        )
                .map(response -> {
                    if (response == null) {
                        throw new IllegalStateException("Null response from Redis");
                    }
                    if (response.get(1).toLong() == 1) {
                        LOG.debugf("Migrated legacy counter %s", redisKey);
                    }
                    return new WindowRecord(response.get(0).toLong(), kind, consumer, window.windowId(),
                            window.expiresAt(), now);
                });
    }

    Uni<WindowRecord> read(String identity, WindowKind kind, String consumer, Instant now) {
        final var window = WindowKeyer.keyFor(kind, now);
        final var redisKey = redisKey(identity, window, consumer);

        return redisDataSource
                .execute("EVAL", READ_SCRIPT, "1", redisKey)
                .map(response -> {
                    if (response == null) {
                        throw new IllegalStateException("Null response from Redis");
                    }
                    final var lastMs = response.get(1).toLong();
                    return new WindowRecord(
                            response.get(0).toLong(),
                            kind,
                            consumer,
                            window.windowId(),
                            window.expiresAt(),
                            lastMs > 0 ? Instant.ofEpochMilli(lastMs) : null);
                });
    }

    Uni<SweepResult> sweep(String pattern, Duration retention, Instant now) {
        final var args = new KeyScanArgs().match(pattern).count(scanCount);
        return keyCommands
                .scan(args)
                .toMulti()
                .onItem()
                .transformToUniAndConcatenate(key -> sweepKey(key, retention, now))
                .collect()
                .asList()
                .map(results -> results.stream().reduce(SweepResult.empty(), SweepResult::merge));
    }

    String identityPattern(String identity) {
        return counterPrefix + escapeGlob(identity) + ":" + CounterKey.PREFIX + "*";
    }

    private Uni<SweepResult> sweepKey(String redisKey, Duration retention, Instant now) {
        return loadStored(redisKey)
                .flatMap(stored -> {
                    if (stored.isEmpty()) {
                        return Uni.createFrom().item(SweepResult.empty());
                    }
                    final var verdict =
                            CounterRetention.judge(counterKeyOf(redisKey), stored.get(), retention, now);
                    return switch (verdict) {
                        case DELETE -> keyCommands
                                .del(redisKey)
                                .replaceWith(new SweepResult(List.of(redisKey), List.of(), List.of()));
                        case UNKNOWN_AGE -> Uni.createFrom()
                                .item(new SweepResult(List.of(), List.of(), List.of(redisKey)));
                        case KEEP -> Uni.createFrom().item(SweepResult.empty());
                    };
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Failed to sweep counter %s: %s", redisKey, error.getMessage());
                    return new SweepResult(List.of(), List.of(new SweepError(redisKey, error.getMessage())), List.of());
                });
    }

    private Uni<Optional<StoredCounter>> loadStored(String redisKey) {
        return keyCommands.type(redisKey).flatMap(type -> switch (type) {
            case STRING -> valueCommands
                    .get(redisKey)
                    .map(value -> value == null
                            ? Optional.<StoredCounter>empty()
                            : Optional.<StoredCounter>of(new StoredCounter.LegacyCount(Long.parseLong(value.trim()))));
            case HASH -> hashCommands
                    .hgetall(redisKey)
                    .map(fields -> fields == null || fields.isEmpty()
                            ? Optional.<StoredCounter>empty()
                            : Optional.of(StoredCounter.of(toRecord(fields))));
            default -> Uni.createFrom().item(Optional.<StoredCounter>empty());
        });
    }

    private static WindowRecord toRecord(Map<String, String> fields) {
        final var lastMs = fields.get(FIELD_LAST_INCREMENT_AT);
        return new WindowRecord(
                Long.parseLong(fields.get(FIELD_COUNT)),
                WindowKind.parse(fields.get(FIELD_KIND)),
                fields.get(FIELD_CONSUMER),
                fields.get(FIELD_WINDOW_ID),
                Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_EXPIRES_AT))),
                lastMs != null ? Instant.ofEpochMilli(Long.parseLong(lastMs)) : null);
    }

    private String redisKey(String identity, WindowKey window, String consumer) {
        return counterPrefix + identity + ":" + window.counterKey(consumer);
    }

    private String counterKeyOf(String redisKey) {
        final var marker = redisKey.indexOf(":" + CounterKey.PREFIX, counterPrefix.length());
        return marker < 0 ? redisKey : redisKey.substring(marker + 1);
    }

    private Optional<String> identityOf(String redisKey) {
        final var marker = redisKey.indexOf(":" + CounterKey.PREFIX, counterPrefix.length());
        return marker < 0 ? Optional.empty() : Optional.of(redisKey.substring(counterPrefix.length(), marker));
    }

    private static String escapeGlob(String value) {
        return value.replaceAll("([*?\\[\\]\\\\])", "\\\\$1");
    }
}

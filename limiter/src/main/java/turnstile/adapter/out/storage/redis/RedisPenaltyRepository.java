package turnstile.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import turnstile.core.model.access.PenaltyState;
import turnstile.spi.PenaltyRepository;

/**
 * Redis implementation of PenaltyRepository.
 *
 * <p>Key format: {@code {prefix}penalty:{identity}}, a hash with fields
 * {@code violationCount}, {@code lastViolationAt}, {@code blockExpiresAt},
 * {@code banned} and {@code blockCount}. Instants are epoch milliseconds.
 *
 * <p>Every mutation is a single Lua script, so concurrent updates from
 * different instances are applied atomically.
 */
public class RedisPenaltyRepository implements PenaltyRepository {

    private static final Logger LOG = Logger.getLogger(RedisPenaltyRepository.class);

    private static final String FIELD_VIOLATION_COUNT = "violationCount";
    private static final String FIELD_LAST_VIOLATION_AT = "lastViolationAt";
    private static final String FIELD_BLOCK_EXPIRES_AT = "blockExpiresAt";
    private static final String FIELD_BANNED = "banned";
    private static final String FIELD_BLOCK_COUNT = "blockCount";

    /**
     * KEYS[1] - penalty key; ARGV[1] - violation time in milliseconds.
     */
    static final String RECORD_VIOLATION_SCRIPT =
            """
            local key = KEYS[1]
            redis.call('HINCRBY', key, 'violationCount', 1)
            redis.call('HSET', key, 'lastViolationAt', ARGV[1])
            return redis.call('HGETALL', key)
            """;

    /**
     * KEYS[1] - penalty key; ARGV[1] - requested block expiry; ARGV[2] - now (milliseconds).
     */
    private static final String APPLY_BLOCK_SCRIPT =
            """
            local key = KEYS[1]
            local requested = tonumber(ARGV[1])
            local now_ms = tonumber(ARGV[2])
            local current = tonumber(redis.call('HGET', key, 'blockExpiresAt') or '0') or 0

            if current > now_ms then
                if requested > current then
                    redis.call('HSET', key, 'blockExpiresAt', requested)
                end
            else
                redis.call('HSET', key, 'blockExpiresAt', requested)
                redis.call('HINCRBY', key, 'blockCount', 1)
            end
            return redis.call('HGETALL', key)
            """;

    private static final String MARK_BANNED_SCRIPT =
            """
            local key = KEYS[1]
            redis.call('HSET', key, 'banned', 'true')
            return redis.call('HGETALL', key)
            """;

    /**
     * KEYS[1] - penalty key; ARGV[1] - now; ARGV[2] - retention cutoff (milliseconds).
     *
     * <p>Deletes the state only if it is still stale when the script runs:
     * not banned, no active block, and no violation since the cutoff.
     */
    static final String DELETE_IF_STALE_SCRIPT =
            """
            local key = KEYS[1]
            local now_ms = tonumber(ARGV[1])
            local cutoff_ms = tonumber(ARGV[2])

            if redis.call('EXISTS', key) == 0 then
                return 0
            end
            local fields = redis.call('HMGET', key, 'lastViolationAt', 'blockExpiresAt', 'banned')
            if fields[3] == 'true' then
                return 0
            end
            local block = tonumber(fields[2] or '0') or 0
            if block > now_ms then
                return 0
            end
            local last = tonumber(fields[1] or '0') or 0
            if last > 0 and last >= cutoff_ms then
                return 0
            end
            return redis.call('DEL', key)
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String penaltyPrefix;
    private final int scanCount;

    public RedisPenaltyRepository(ReactiveRedisDataSource redisDataSource, String keyPrefix, int scanCount) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.penaltyPrefix = keyPrefix + "penalty:";
        this.scanCount = scanCount;
        LOG.info("Initialized Redis penalty repository");
    }

    @Override
    public Uni<PenaltyState> recordViolation(String identity, Instant now) {
        return redisDataSource
                .execute("EVAL", RECORD_VIOLATION_SCRIPT, "1", penaltyPrefix + identity, millis(now))
                .map(response -> toState(identity, toMap(response)))
                .invoke(state -> LOG.debugf(
                        "Recorded violation for %s: count=%d", identity, state.violationCount()));
    }

    @Override
    public Uni<PenaltyState> applyBlock(String identity, Instant blockExpiresAt, Instant now) {
        return redisDataSource
                .execute("EVAL", APPLY_BLOCK_SCRIPT, "1", penaltyPrefix + identity, millis(blockExpiresAt), millis(now))
                .map(response -> toState(identity, toMap(response)));
    }

    @Override
    public Uni<PenaltyState> markBanned(String identity) {
        return redisDataSource
                .execute("EVAL", MARK_BANNED_SCRIPT, "1", penaltyPrefix + identity)
                .map(response -> toState(identity, toMap(response)));
    }

    @Override
    public Uni<Optional<PenaltyState>> find(String identity) {
        return hashCommands
                .hgetall(penaltyPrefix + identity)
                .map(fields -> fields == null || fields.isEmpty()
                        ? Optional.<PenaltyState>empty()
                        : Optional.of(toState(identity, fields)));
    }

    @Override
    public Uni<Boolean> delete(String identity) {
        return keyCommands.del(penaltyPrefix + identity).map(deleted -> deleted > 0);
    }

    @Override
    public Multi<PenaltyState> streamAll() {
        final var args = new KeyScanArgs().match(penaltyPrefix + "*").count(scanCount);
        return keyCommands
                .scan(args)
                .toMulti()
                .onItem()
                .transformToUniAndMerge(redisKey -> find(redisKey.substring(penaltyPrefix.length())))
                .select()
                .where(Optional::isPresent)
                .map(Optional::get);
    }

    @Override
    public Uni<Long> sweepStale(Duration retention, Instant now) {
        return streamAll()
                .select()
                .where(state -> state.isStale(retention, now))
                .onItem()
                .transformToUniAndConcatenate(state -> deleteIfStale(state.identity(), retention, now))
                .select()
                .where(Boolean::booleanValue)
                .collect()
                .with(Collectors.counting());
    }

    /**
     * Delete a state only if it is still stale, re-checked atomically in Redis.
     *
     * <p>A violation recorded after the sweep read the state keeps it alive.
     */
    Uni<Boolean> deleteIfStale(String identity, Duration retention, Instant now) {
        return redisDataSource
                .execute(
                        "EVAL",
                        DELETE_IF_STALE_SCRIPT,
                        "1",
                        penaltyPrefix + identity,
                        millis(now),
                        millis(now.minus(retention)))
                .map(response -> response != null && response.toLong() > 0);
    }

    private static String millis(Instant instant) {
        return String.valueOf(instant.toEpochMilli());
    }

    private static Map<String, String> toMap(Response response) {
        if (response == null) {
            throw new IllegalStateException("Null response from Redis");
        }
        final var fields = new HashMap<String, String>();
        for (var i = 0; i + 1 < response.size(); i += 2) {
            fields.put(response.get(i).toString(), response.get(i + 1).toString());
        }
        return fields;
    }

    private static PenaltyState toState(String identity, Map<String, String> fields) {
        return new PenaltyState(
                identity,
                parseInt(fields.get(FIELD_VIOLATION_COUNT)),
                parseInstant(fields.get(FIELD_LAST_VIOLATION_AT)),
                parseInstant(fields.get(FIELD_BLOCK_EXPIRES_AT)),
                Boolean.parseBoolean(fields.get(FIELD_BANNED)),
                parseInt(fields.get(FIELD_BLOCK_COUNT)));
    }

    private static int parseInt(String value) {
        return value != null ? Integer.parseInt(value) : 0;
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        final var millis = Long.parseLong(value);
        return millis > 0 ? Instant.ofEpochMilli(millis) : null;
    }
}

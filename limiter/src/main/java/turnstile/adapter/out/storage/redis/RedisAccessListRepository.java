package turnstile.adapter.out.storage.redis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.model.access.AccessListEntry;
import turnstile.core.model.access.AccessListType;
import turnstile.spi.AccessListRepository;

/**
 * Redis implementation of AccessListRepository.
 *
 * <p>Key format:
 * <ul>
 *   <li>Entry: {@code {prefix}access:{type}:entry:{pattern}} (hash with reason, addedBy, addedAt)</li>
 *   <li>Prefix index: {@code {prefix}access:{type}:prefixes} (set of prefix patterns)</li>
 * </ul>
 *
 * <p>An exact match is a single key lookup. Prefix matches are resolved from
 * the prefix index, which keeps lookups independent of the list size.
 */
public class RedisAccessListRepository implements AccessListRepository {

    private static final Logger LOG = Logger.getLogger(RedisAccessListRepository.class);

    private static final String FIELD_REASON = "reason";
    private static final String FIELD_ADDED_BY = "addedBy";
    private static final String FIELD_ADDED_AT = "addedAt";

    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String accessPrefix;
    private final int scanCount;

    public RedisAccessListRepository(ReactiveRedisDataSource redisDataSource, String keyPrefix, int scanCount) {
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.accessPrefix = keyPrefix + "access:";
        this.scanCount = scanCount;
        LOG.info("Initialized Redis access list repository");
    }

    @Override
    public Uni<Void> save(AccessListEntry entry) {
        final var fields = Map.of(
                FIELD_REASON, nullSafe(entry.reason()),
                FIELD_ADDED_BY, nullSafe(entry.addedBy()),
                FIELD_ADDED_AT, entry.addedAt() != null ? String.valueOf(entry.addedAt().toEpochMilli()) : "0");
        final var write = hashCommands.hset(entryKey(entry.type(), entry.pattern()), fields);
        if (!entry.prefix()) {
            return write.replaceWithVoid();
        }
        return write.call(() -> setCommands.sadd(prefixIndexKey(entry.type()), entry.pattern()))
                .replaceWithVoid();
    }

    @Override
    public Uni<Boolean> remove(AccessListType type, String pattern) {
        return keyCommands
                .del(entryKey(type, pattern))
                .call(() -> setCommands.srem(prefixIndexKey(type), pattern))
                .map(deleted -> deleted > 0);
    }

    @Override
    public Uni<Optional<AccessListEntry>> findMatch(AccessListType type, String identity) {
        return load(type, identity).flatMap(exact -> {
            if (exact.isPresent() && !exact.get().prefix()) {
                return Uni.createFrom().item(exact);
            }
            return setCommands.smembers(prefixIndexKey(type)).flatMap(patterns -> {
                final var candidates = new ArrayList<AccessListEntry>();
                for (var pattern : patterns) {
                    candidates.add(AccessListEntry.of(type, pattern, null, null, null));
                }
                final var best = AccessListEntry.bestMatch(candidates, identity);
                if (best.isEmpty()) {
                    return Uni.createFrom().item(Optional.<AccessListEntry>empty());
                }
                return load(type, best.get().pattern());
            });
        });
    }

    @Override
    public Multi<AccessListEntry> streamAll(AccessListType type) {
        final var entryPrefix = accessPrefix + typeSegment(type) + ":entry:";
        final var args = new KeyScanArgs().match(entryPrefix + "*").count(scanCount);
        return keyCommands
                .scan(args)
                .toMulti()
                .onItem()
                .transformToUniAndMerge(redisKey -> load(type, redisKey.substring(entryPrefix.length())))
                .select()
                .where(Optional::isPresent)
                .map(Optional::get);
    }

    private Uni<Optional<AccessListEntry>> load(AccessListType type, String pattern) {
        return hashCommands.hgetall(entryKey(type, pattern)).map(fields -> {
            if (fields == null || fields.isEmpty()) {
                return Optional.<AccessListEntry>empty();
            }
            final var addedAt = fields.get(FIELD_ADDED_AT);
            final var millis = addedAt != null ? Long.parseLong(addedAt) : 0L;
            return Optional.of(AccessListEntry.of(
                    type,
                    pattern,
                    emptyToNull(fields.get(FIELD_REASON)),
                    emptyToNull(fields.get(FIELD_ADDED_BY)),
                    millis > 0 ? Instant.ofEpochMilli(millis) : null));
        });
    }

    private String entryKey(AccessListType type, String pattern) {
        return accessPrefix + typeSegment(type) + ":entry:" + pattern;
    }

    private String prefixIndexKey(AccessListType type) {
        return accessPrefix + typeSegment(type) + ":prefixes";
    }

    private static String typeSegment(AccessListType type) {
        return type.name().toLowerCase();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}

package turnstile.adapter.out.storage.memory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.model.access.AccessListEntry;
import turnstile.core.model.access.AccessListType;
import turnstile.spi.AccessListRepository;

/**
 * In-memory implementation of AccessListRepository.
 *
 * <p>
 * Entries are lost on restart and not shared across instances.
 */
public class InMemoryAccessListRepository implements AccessListRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryAccessListRepository.class);

    private final Map<AccessListType, ConcurrentMap<String, AccessListEntry>> lists =
            new EnumMap<>(AccessListType.class);

    public InMemoryAccessListRepository() {
        for (var type : AccessListType.values()) {
            lists.put(type, new ConcurrentHashMap<>());
        }
        LOG.info("Initialized in-memory access list repository");
    }

    @Override
    public Uni<Void> save(AccessListEntry entry) {
        return Uni.createFrom().item(() -> {
            lists.get(entry.type()).put(entry.pattern(), entry);
            return null;
        });
    }

    @Override
    public Uni<Boolean> remove(AccessListType type, String pattern) {
        return Uni.createFrom().item(() -> lists.get(type).remove(pattern) != null);
    }

    @Override
    public Uni<Optional<AccessListEntry>> findMatch(AccessListType type, String identity) {
        return Uni.createFrom().item(() -> {
            final var entries = lists.get(type);
            final var exact = entries.get(identity);
            if (exact != null && !exact.prefix()) {
                return Optional.of(exact);
            }
            return AccessListEntry.bestMatch(entries.values(), identity);
        });
    }

    @Override
    public Multi<AccessListEntry> streamAll(AccessListType type) {
        return Multi.createFrom().iterable(lists.get(type).values());
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        lists.values().forEach(Map::clear);
    }
}

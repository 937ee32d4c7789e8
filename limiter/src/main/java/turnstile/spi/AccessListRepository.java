package turnstile.spi;

import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import turnstile.core.model.access.AccessListEntry;
import turnstile.core.model.access.AccessListType;

/**
 * SPI for storing allow-list and deny-list entries.
 *
 * <p>Entries are keyed by list type and pattern; saving an entry with an
 * existing pattern replaces it.
 *
 * @see turnstile.adapter.out.storage.redis.RedisAccessListRepository
 * @see turnstile.adapter.out.storage.memory.InMemoryAccessListRepository
 */
public interface AccessListRepository {

    /**
     * @param entry the entry to store
     * @return completion signal
     */
    Uni<Void> save(AccessListEntry entry);

    /**
     * @param type the list
     * @param pattern the pattern to remove
     * @return Uni with true if an entry was removed
     */
    Uni<Boolean> remove(AccessListType type, String pattern);

    /**
     * Find the entry that governs {@code identity}.
     *
     * <p>An exact entry wins over prefix entries, and the longest matching
     * prefix wins among prefix entries.
     *
     * @param type the list
     * @param identity the identity to match
     * @return Uni with the governing entry, empty if none matches
     */
    Uni<Optional<AccessListEntry>> findMatch(AccessListType type, String identity);

    /**
     * @param type the list
     * @return Multi streaming every entry of the list
     */
    Multi<AccessListEntry> streamAll(AccessListType type);
}

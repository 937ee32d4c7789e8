package turnstile.adapter.out.storage.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.model.access.PenaltyState;
import turnstile.spi.PenaltyRepository;

/**
 * In-memory implementation of PenaltyRepository.
 *
 * <p>
 * Every mutation runs inside {@link ConcurrentHashMap#compute}, so updates to
 * one identity are atomic. Penalties are lost on restart and not shared
 * across instances.
 */
public class InMemoryPenaltyRepository implements PenaltyRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryPenaltyRepository.class);

    private final ConcurrentMap<String, PenaltyState> states = new ConcurrentHashMap<>();

    public InMemoryPenaltyRepository() {
        LOG.info("Initialized in-memory penalty repository");
    }

    @Override
    public Uni<PenaltyState> recordViolation(String identity, Instant now) {
        return Uni.createFrom().item(() -> states.compute(identity, (id, existing) -> {
            final var current = existing != null ? existing : PenaltyState.clean(id);
            return new PenaltyState(
                    id,
                    current.violationCount() + 1,
                    now,
                    current.blockExpiresAt(),
                    current.banned(),
                    current.blockCount());
        }));
    }

    @Override
    public Uni<PenaltyState> applyBlock(String identity, Instant blockExpiresAt, Instant now) {
        return Uni.createFrom().item(() -> states.compute(identity, (id, existing) -> {
            final var current = existing != null ? existing : PenaltyState.clean(id);
            if (current.isBlocked(now)) {
                final var extended = blockExpiresAt.isAfter(current.blockExpiresAt())
                        ? blockExpiresAt
                        : current.blockExpiresAt();
                return new PenaltyState(
                        id,
                        current.violationCount(),
                        current.lastViolationAt(),
                        extended,
                        current.banned(),
                        current.blockCount());
            }
            return new PenaltyState(
                    id,
                    current.violationCount(),
                    current.lastViolationAt(),
                    blockExpiresAt,
                    current.banned(),
                    current.blockCount() + 1);
        }));
    }

    @Override
    public Uni<PenaltyState> markBanned(String identity) {
        return Uni.createFrom().item(() -> states.compute(identity, (id, existing) -> {
            final var current = existing != null ? existing : PenaltyState.clean(id);
            return new PenaltyState(
                    id,
                    current.violationCount(),
                    current.lastViolationAt(),
                    current.blockExpiresAt(),
                    true,
                    current.blockCount());
        }));
    }

    @Override
    public Uni<Optional<PenaltyState>> find(String identity) {
        return Uni.createFrom().item(() -> Optional.ofNullable(states.get(identity)));
    }

    @Override
    public Uni<Boolean> delete(String identity) {
        return Uni.createFrom().item(() -> states.remove(identity) != null);
    }

    @Override
    public Multi<PenaltyState> streamAll() {
        return Multi.createFrom().iterable(states.values());
    }

    @Override
    public Uni<Long> sweepStale(Duration retention, Instant now) {
        return Uni.createFrom().item(() -> {
            final var before = states.size();
            states.values().removeIf(state -> state.isStale(retention, now));
            final long removed = before - states.size();
            if (removed > 0) {
                LOG.debugf("Removed %d stale penalty states", removed);
            }
            return removed;
        });
    }

    /**
     * Get the number of tracked identities (for testing).
     */
    public int size() {
        return states.size();
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        states.clear();
    }
}

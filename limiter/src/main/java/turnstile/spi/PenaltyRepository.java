package turnstile.spi;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import turnstile.core.model.access.PenaltyState;

/**
 * SPI for storing per-identity penalty state.
 *
 * <p>Penalty state is shared between all instances and updated concurrently,
 * so every mutation must be applied atomically by the storage layer.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>{@link #recordViolation} MUST increment atomically</li>
 *   <li>{@link #applyBlock} MUST never shorten an active block</li>
 *   <li>All operations MUST be non-blocking (return Uni/Multi)</li>
 *   <li>Implementations SHOULD be thread-safe</li>
 * </ul>
 *
 * @see turnstile.adapter.out.storage.redis.RedisPenaltyRepository
 * @see turnstile.adapter.out.storage.memory.InMemoryPenaltyRepository
 * @see turnstile.core.service.access.PenaltyLedger
 */
public interface PenaltyRepository {

    /**
     * Record one rate limit violation.
     *
     * @param identity the violating identity
     * @param now time of the violation
     * @return Uni with the state after incrementing
     */
    Uni<PenaltyState> recordViolation(String identity, Instant now);

    /**
     * Apply a temporary block.
     *
     * <p>When a block is already active at {@code now}, its expiry becomes
     * the later of the two and the block count is unchanged. Otherwise the
     * new block is set and the block count is incremented.
     *
     * @param identity the identity to block
     * @param blockExpiresAt requested end of the block
     * @param now current time
     * @return Uni with the state after the update
     */
    Uni<PenaltyState> applyBlock(String identity, Instant blockExpiresAt, Instant now);

    /**
     * Mark an identity as permanently banned.
     *
     * @param identity the identity to ban
     * @return Uni with the state after the update
     */
    Uni<PenaltyState> markBanned(String identity);

    /**
     * @param identity the identity
     * @return Uni with the stored state, empty if none
     */
    Uni<Optional<PenaltyState>> find(String identity);

    /**
     * Delete the state of an identity.
     *
     * @param identity the identity
     * @return Uni with true if a state was deleted
     */
    Uni<Boolean> delete(String identity);

    /**
     * Stream every stored state.
     *
     * @return Multi streaming penalty states
     */
    Multi<PenaltyState> streamAll();

    /**
     * Delete states that are idle: last violation older than
     * {@code now - retention}, no active block and not banned.
     *
     * @param retention idle period after which a state is deleted
     * @param now current time
     * @return Uni with the number of states deleted
     */
    Uni<Long> sweepStale(Duration retention, Instant now);
}

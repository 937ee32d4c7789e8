package turnstile.core.port.out;

import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.ratelimit.SweepResult;
import turnstile.core.model.ratelimit.WindowKind;
import turnstile.core.model.ratelimit.WindowRecord;

/**
 * Port interface for the window counters of a single identity.
 *
 * <p>Each identity has exactly one actor, and every counter write for that
 * identity goes through it. Counters are stored under
 * {@code counter:{kind}:{windowId}:{consumer}} within the identity's partition.
 *
 * <p>Storage failures surface as a failed {@link Uni}. Actors never retry;
 * the caller decides whether to fall back.
 */
public interface CounterActor {

    /**
     * Identity this actor owns.
     *
     * @return the identity
     */
    String identity();

    /**
     * Atomically increment the counter of the window containing {@code now}.
     *
     * <p>Reads the stored value, resolves a legacy bare count if present,
     * and writes back a structured record with {@code count + 1}. Concurrent
     * increments of the same key never lose an update.
     *
     * @param kind the window kind
     * @param consumer the consumer
     * @param now time of the request
     * @return the record after incrementing
     */
    Uni<WindowRecord> increment(WindowKind kind, String consumer, Instant now);

    /**
     * Read the counter of the window containing {@code now} without changing it.
     *
     * @param kind the window kind
     * @param consumer the consumer
     * @param now time of the read
     * @return the current record, with count 0 when nothing is stored
     */
    Uni<WindowRecord> read(WindowKind kind, String consumer, Instant now);

    /**
     * Delete this actor's expired counters.
     *
     * <p>A structured counter is deleted once its window has closed or it
     * has not been incremented within {@code retention}. Legacy counters are
     * aged from their window identifier; those whose age cannot be determined
     * are kept and reported. A failure on one key is recorded and the sweep
     * continues.
     *
     * @param retention maximum idle age
     * @param now current time
     * @return the sweep result
     */
    Uni<SweepResult> sweepExpired(Duration retention, Instant now);
}

package turnstile.core.port.out;

import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.ratelimit.SweepResult;

/**
 * Port interface for locating the counter actor of an identity.
 */
public interface CounterActorDirectory {

    /**
     * Return the actor that owns {@code identity}'s counters.
     *
     * @param identity the client identity
     * @return the actor, created on first use
     */
    CounterActor actorFor(String identity);

    /**
     * Sweep the counters of every known identity and merge the results.
     *
     * @param retention maximum idle age
     * @param now current time
     * @return the merged sweep result
     */
    Uni<SweepResult> sweepExpired(Duration retention, Instant now);

    /**
     * Count identities that currently hold counters.
     *
     * @return the identity count
     */
    Uni<Long> identityCount();
}
